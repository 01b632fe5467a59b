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

import org.elasticsoftware.sequent.aggregate.AggregateRoot;
import org.elasticsoftware.sequent.errors.InvalidCommandDeclarationException;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.HashMap;
import java.util.Map;

public final class CommandTypes {
    private CommandTypes() {
    }

    /**
     * Walks the superclass chain of {@code commandType} up to {@link AggregateCommand} and returns
     * the aggregate root type its type argument is bound to.
     *
     * @throws InvalidCommandDeclarationException when the command does not extend
     *         {@link AggregateCommand} or leaves its type argument open
     */
    public static Class<? extends AggregateRoot> resolveAggregateRootType(Class<?> commandType) {
        Map<TypeVariable<?>, Type> bindings = new HashMap<>();
        Class<?> current = commandType;
        while (current != null && current != Object.class) {
            Type superType = current.getGenericSuperclass();
            if (superType instanceof ParameterizedType parameterizedType) {
                Class<?> rawSuperType = (Class<?>) parameterizedType.getRawType();
                TypeVariable<?>[] typeParameters = rawSuperType.getTypeParameters();
                Type[] typeArguments = parameterizedType.getActualTypeArguments();
                for (int i = 0; i < typeParameters.length; i++) {
                    Type typeArgument = typeArguments[i];
                    // propagate bindings made further down the hierarchy
                    if (typeArgument instanceof TypeVariable<?> typeVariable && bindings.containsKey(typeVariable)) {
                        typeArgument = bindings.get(typeVariable);
                    }
                    bindings.put(typeParameters[i], typeArgument);
                }
                if (rawSuperType == AggregateCommand.class) {
                    return toAggregateRootType(commandType, bindings.get(typeParameters[0]));
                }
                current = rawSuperType;
            } else if (superType == AggregateCommand.class) {
                throw new InvalidCommandDeclarationException(commandType, "AggregateCommand is extended as a raw type");
            } else if (superType instanceof Class<?> superClass) {
                current = superClass;
            } else {
                break;
            }
        }
        throw new InvalidCommandDeclarationException(commandType, "it does not extend AggregateCommand");
    }

    private static Class<? extends AggregateRoot> toAggregateRootType(Class<?> commandType, Type typeArgument) {
        Class<?> rawType = null;
        if (typeArgument instanceof Class<?> c) {
            rawType = c;
        } else if (typeArgument instanceof ParameterizedType p) {
            rawType = (Class<?>) p.getRawType();
        }
        if (rawType == null || !AggregateRoot.class.isAssignableFrom(rawType)) {
            throw new InvalidCommandDeclarationException(commandType,
                    "the type argument of AggregateCommand is not bound to an aggregate root type but to " + typeArgument);
        }
        return rawType.asSubclass(AggregateRoot.class);
    }
}
