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

package org.elasticsoftware.sequent.commands;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.sequent.aggregate.AggregateRoot;
import org.elasticsoftware.sequent.errors.UnmappedCommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of command handlers, keyed by the runtime type of the command. Every command type can
 * be registered exactly once.
 */
public class CommandMapper {
    private static final Logger log = LoggerFactory.getLogger(CommandMapper.class);
    private final Map<Class<? extends Command>, CommandMapping<?>> mappings = new ConcurrentHashMap<>();

    /**
     * Registers a handler that receives the aggregate root targeted by the command. The aggregate
     * root is created when it does not exist yet.
     *
     * @throws IllegalArgumentException when {@code aggregateRootType} differs from the type the
     *         command declares through {@link AggregateCommand}
     * @throws IllegalStateException when a handler is already registered for {@code commandType}
     */
    public <C extends AggregateCommand<A>, A extends AggregateRoot> CommandMapper register(
            @NotNull Class<C> commandType,
            @NotNull Class<A> aggregateRootType,
            @NotNull CommandHandlerFunction<C, A> handler) {
        Class<? extends AggregateRoot> declaredType = CommandTypes.resolveAggregateRootType(commandType);
        if (!declaredType.equals(aggregateRootType)) {
            throw new IllegalArgumentException("Command " + commandType.getName() + " targets " + declaredType.getName() +
                    ", cannot register a handler for " + aggregateRootType.getName());
        }
        ContextualCommandHandlerFunction<C> adapter = (context, command) ->
                handler.apply(command, context.load(aggregateRootType, command.getAggregateRootId(), true));
        add(new CommandMapping<>(commandType, aggregateRootType, adapter));
        return this;
    }

    /**
     * Registers a handler that loads the aggregate roots it needs itself.
     *
     * @throws IllegalStateException when a handler is already registered for {@code commandType}
     */
    public <C extends Command> CommandMapper map(@NotNull Class<C> commandType,
                                                 @NotNull ContextualCommandHandlerFunction<C> handler) {
        add(new CommandMapping<>(commandType, null, handler));
        return this;
    }

    /**
     * Copies all handlers of {@code other}, so that the same mappings can drive several command
     * processors.
     *
     * @throws IllegalStateException when a command type of {@code other} is already mapped here
     */
    public CommandMapper addMappings(@NotNull CommandMapper other) {
        other.mappings.values().forEach(this::add);
        return this;
    }

    private void add(CommandMapping<?> mapping) {
        CommandMapping<?> existing = mappings.putIfAbsent(mapping.commandType(), mapping);
        if (existing != null) {
            throw new IllegalStateException("A handler has already been registered for command " + mapping.commandType().getName());
        }
        log.debug("Registered handler for command {} (aggregate root {})",
                mapping.commandType().getSimpleName(),
                mapping.aggregateRootType() != null ? mapping.aggregateRootType().getSimpleName() : "<context>");
    }

    public CommandMapping<?> resolve(@NotNull Command command) {
        return find(command.getClass()).orElseThrow(() -> new UnmappedCommandException(command.getClass()));
    }

    public Optional<CommandMapping<?>> find(Class<? extends Command> commandType) {
        return Optional.ofNullable(mappings.get(commandType));
    }

    public boolean isMapped(Class<? extends Command> commandType) {
        return mappings.containsKey(commandType);
    }

    public Set<Class<? extends Command>> getMappedCommandTypes() {
        return Set.copyOf(mappings.keySet());
    }
}
