/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.sequent.views;

import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.eventstore.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Forwards events to every registered {@link ViewManager}. A failing view manager does not keep the
 * others from receiving the events; all failures are reported together afterwards.
 */
public class ViewManagerEventDispatcher implements EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ViewManagerEventDispatcher.class);
    private final List<ViewManager> viewManagers = new CopyOnWriteArrayList<>();

    public ViewManagerEventDispatcher(ViewManager... viewManagers) {
        this(List.of(viewManagers));
    }

    public ViewManagerEventDispatcher(Collection<? extends ViewManager> viewManagers) {
        this.viewManagers.addAll(viewManagers);
    }

    public ViewManagerEventDispatcher addViewManager(ViewManager viewManager) {
        viewManagers.add(viewManager);
        return this;
    }

    public List<ViewManager> getViewManagers() {
        return List.copyOf(viewManagers);
    }

    @Override
    public void initialize(EventStore eventStore, boolean purgeExistingViews) {
        for (ViewManager viewManager : viewManagers) {
            log.info("Initializing view manager {}", viewManager.getName());
            viewManager.initialize(eventStore, purgeExistingViews);
        }
    }

    @Override
    public void dispatch(EventStore eventStore, List<DomainEvent> events) {
        List<String> failed = new ArrayList<>();
        RuntimeException failure = null;
        for (ViewManager viewManager : viewManagers) {
            try {
                viewManager.dispatch(eventStore, events);
            } catch (RuntimeException e) {
                log.error("View manager {} failed to process {} events", viewManager.getName(), events.size(), e);
                failed.add(viewManager.getName());
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw new ViewDispatchException(failed, failure);
        }
    }
}
