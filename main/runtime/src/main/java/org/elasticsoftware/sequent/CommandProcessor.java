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

package org.elasticsoftware.sequent;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.sequent.aggregate.AggregateRoot;
import org.elasticsoftware.sequent.aggregate.AggregateRootRepository;
import org.elasticsoftware.sequent.aggregate.DefaultCommandContext;
import org.elasticsoftware.sequent.aggregate.DefaultUnitOfWork;
import org.elasticsoftware.sequent.commands.Command;
import org.elasticsoftware.sequent.commands.CommandMapper;
import org.elasticsoftware.sequent.commands.CommandMapping;
import org.elasticsoftware.sequent.commands.CommandTypes;
import org.elasticsoftware.sequent.errors.CommandProcessingException;
import org.elasticsoftware.sequent.errors.DispatchException;
import org.elasticsoftware.sequent.errors.InvalidCommandDeclarationException;
import org.elasticsoftware.sequent.errors.UnmappedCommandException;
import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.eventstore.ConcurrencyException;
import org.elasticsoftware.sequent.eventstore.EventStore;
import org.elasticsoftware.sequent.util.Retryer;
import org.elasticsoftware.sequent.views.EventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns commands into persisted domain events and hands those to the {@link EventDispatcher}.
 *
 * <p>Each command is executed in a fresh {@link DefaultUnitOfWork}: the handler runs against
 * freshly loaded aggregate roots, the events they emit are saved as one batch, and when the save
 * collides with a concurrent write the whole execution is repeated. Dispatching happens once,
 * after the batch is durable, and its failure never undoes the write.
 *
 * <p>Instances are thread-safe, commands may be processed concurrently.
 */
public class CommandProcessor {
    private static final Logger log = LoggerFactory.getLogger(CommandProcessor.class);
    private final Retryer retryer = new Retryer();
    private final EventStore eventStore;
    private final AggregateRootRepository aggregateRootRepository;
    private final EventDispatcher eventDispatcher;
    private final CommandMapper commandMapper;
    private final CommandProcessorOptions options;

    public CommandProcessor(EventStore eventStore,
                            AggregateRootRepository aggregateRootRepository,
                            EventDispatcher eventDispatcher,
                            CommandMapper commandMapper,
                            CommandProcessorOptions options) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.aggregateRootRepository = Objects.requireNonNull(aggregateRootRepository, "aggregateRootRepository");
        this.eventDispatcher = Objects.requireNonNull(eventDispatcher, "eventDispatcher");
        this.commandMapper = Objects.requireNonNull(commandMapper, "commandMapper");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Gives the views a chance to catch up with the event store.
     */
    public void initialize() {
        log.info("Initializing event dispatcher (purgeExistingViews={})", options.isPurgeExistingViews());
        eventDispatcher.initialize(eventStore, options.isPurgeExistingViews());
    }

    public CommandProcessorOptions getOptions() {
        return options;
    }

    /**
     * @throws ConcurrencyException when the events still collided after the configured retries
     * @throws UnmappedCommandException when no handler is registered for the command
     * @throws InvalidCommandDeclarationException when the command does not declare its aggregate root type
     * @throws CommandProcessingException wrapping any other failure that is not a configured
     *         domain exception; nothing has been saved in that case
     * @throws DispatchException when the events were saved but could not be dispatched
     */
    public CommandProcessingResult processCommand(@NotNull Command command) {
        Objects.requireNonNull(command, "command");
        Class<? extends AggregateRoot> aggregateRootType = resolveAggregateRootType(command);
        log.debug("Processing {} targeting {}", command,
                aggregateRootType != null ? aggregateRootType.getSimpleName() : "<context>");

        List<DomainEvent> emittedEvents;
        try {
            UUID batchId = UUID.randomUUID();
            emittedEvents = retryer.retryOn(ConcurrencyException.class,
                    () -> doProcessCommand(batchId, command),
                    options.getMaxRetries());
        } catch (RuntimeException exception) {
            if (propagatesUnchanged(exception)) {
                throw exception;
            }
            log.error("Exception while processing {}", command, exception);
            throw CommandProcessingException.create(command, exception);
        }

        if (emittedEvents.isEmpty()) {
            log.debug("{} did not emit any events", command);
            return CommandProcessingResult.empty();
        }

        CommandProcessingResult result = CommandProcessingResult.of(emittedEvents);
        try {
            eventDispatcher.dispatch(eventStore, emittedEvents);
        } catch (RuntimeException exception) {
            log.error("Events with global sequence numbers {} were saved but could not be dispatched",
                    result.globalSequenceNumbers(), exception);
            throw new DispatchException(result.globalSequenceNumbers(), exception);
        }
        return result;
    }

    private List<DomainEvent> doProcessCommand(UUID batchId, Command command) {
        DefaultUnitOfWork unitOfWork = new DefaultUnitOfWork();
        CommandMapping<?> mapping = commandMapper.resolve(command);
        mapping.invoke(new DefaultCommandContext(unitOfWork, aggregateRootRepository), command);

        List<DomainEvent> emittedEvents = unitOfWork.getEmittedEvents();
        if (emittedEvents.isEmpty()) {
            return emittedEvents;
        }
        for (DomainEvent event : emittedEvents) {
            event.getMeta().merge(command.getMeta());
        }
        eventStore.save(batchId, emittedEvents);
        log.debug("Saved batch {} with {} events for {}", batchId, emittedEvents.size(), command);
        return emittedEvents;
    }

    @Nullable
    private Class<? extends AggregateRoot> resolveAggregateRootType(Command command) {
        Optional<CommandMapping<?>> mapping = commandMapper.find(command.getClass());
        if (mapping.isPresent()) {
            // null for handlers working on a CommandContext
            return mapping.get().aggregateRootType();
        }
        return CommandTypes.resolveAggregateRootType(command.getClass());
    }

    private boolean propagatesUnchanged(RuntimeException exception) {
        return exception instanceof ConcurrencyException
                || exception instanceof UnmappedCommandException
                || exception instanceof InvalidCommandDeclarationException
                || options.isDomainException(exception);
    }
}
