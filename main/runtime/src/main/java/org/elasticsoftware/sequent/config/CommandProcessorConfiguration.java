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

package org.elasticsoftware.sequent.config;

import org.elasticsoftware.sequent.CommandProcessor;
import org.elasticsoftware.sequent.CommandProcessorOptions;
import org.elasticsoftware.sequent.aggregate.AggregateRootRepository;
import org.elasticsoftware.sequent.aggregate.DefaultAggregateRootRepository;
import org.elasticsoftware.sequent.commands.CommandMapper;
import org.elasticsoftware.sequent.eventstore.EventStore;
import org.elasticsoftware.sequent.eventstore.InMemoryEventStore;
import org.elasticsoftware.sequent.eventstore.RocksDBEventStore;
import org.elasticsoftware.sequent.serialization.DomainEventSerializer;
import org.elasticsoftware.sequent.views.EventDispatcher;
import org.elasticsoftware.sequent.views.ViewManager;
import org.elasticsoftware.sequent.views.ViewManagerEventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.util.ClassUtils;

@Configuration
@PropertySource("classpath:sequent-commandprocessor.properties")
public class CommandProcessorConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CommandProcessorConfiguration.class);

    @Bean(name = "sequentCommandProcessorOptions")
    public CommandProcessorOptions commandProcessorOptions(
            @Value("${sequent.commandprocessor.max-retries:10}") int maxRetries,
            @Value("${sequent.commandprocessor.purge-existing-views:false}") boolean purgeExistingViews,
            @Value("${sequent.commandprocessor.domain-exception-types:}") String[] domainExceptionTypes) {
        CommandProcessorOptions options = new CommandProcessorOptions()
                .setMaxRetries(maxRetries)
                .setPurgeExistingViews(purgeExistingViews);
        for (String typeName : domainExceptionTypes) {
            if (!typeName.isBlank()) {
                options.addDomainExceptionTypes(resolveExceptionType(typeName.trim()));
            }
        }
        return options;
    }

    private static Class<? extends Throwable> resolveExceptionType(String typeName) {
        try {
            return ClassUtils.forName(typeName, ClassUtils.getDefaultClassLoader()).asSubclass(Throwable.class);
        } catch (ClassNotFoundException | ClassCastException e) {
            throw new IllegalArgumentException("Invalid domain exception type " + typeName, e);
        }
    }

    @Bean(name = "sequentDomainEventSerializer")
    public DomainEventSerializer domainEventSerializer() {
        return new DomainEventSerializer();
    }

    @Bean(name = "sequentInMemoryEventStore")
    @ConditionalOnProperty(prefix = "sequent.eventstore", name = "type", havingValue = "inmemory", matchIfMissing = true)
    public InMemoryEventStore inMemoryEventStore(DomainEventSerializer serializer) {
        log.info("Using in-memory event store");
        return new InMemoryEventStore(serializer);
    }

    @Bean(name = "sequentRocksDBEventStore", destroyMethod = "close")
    @ConditionalOnProperty(prefix = "sequent.eventstore", name = "type", havingValue = "rocksdb")
    public RocksDBEventStore rocksDBEventStore(@Value("${sequent.rocksdb.baseDir:/tmp/sequent}") String baseDir,
                                               @Value("${sequent.rocksdb.name:events}") String name,
                                               DomainEventSerializer serializer) {
        return new RocksDBEventStore(baseDir, name, serializer);
    }

    @Bean(name = "sequentAggregateRootRepository")
    public DefaultAggregateRootRepository aggregateRootRepository(EventStore eventStore) {
        return new DefaultAggregateRootRepository(eventStore);
    }

    @Bean(name = "sequentEventDispatcher")
    public ViewManagerEventDispatcher eventDispatcher(ObjectProvider<ViewManager> viewManagers) {
        return new ViewManagerEventDispatcher(viewManagers.orderedStream().toList());
    }

    @Bean(name = "sequentCommandMapper")
    public CommandMapper commandMapper(ObjectProvider<CommandMapperCustomizer> customizers) {
        CommandMapper commandMapper = new CommandMapper();
        customizers.orderedStream().forEach(customizer -> customizer.customize(commandMapper));
        log.info("Registered handlers for {} command types", commandMapper.getMappedCommandTypes().size());
        return commandMapper;
    }

    @Bean(name = "sequentCommandProcessor", initMethod = "initialize")
    public CommandProcessor commandProcessor(EventStore eventStore,
                                             AggregateRootRepository aggregateRootRepository,
                                             EventDispatcher eventDispatcher,
                                             CommandMapper commandMapper,
                                             CommandProcessorOptions options) {
        return new CommandProcessor(eventStore, aggregateRootRepository, eventDispatcher, commandMapper, options);
    }
}
