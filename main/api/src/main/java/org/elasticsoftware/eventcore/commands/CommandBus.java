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

package org.elasticsoftware.eventcore.commands;

import org.elasticsoftware.eventcore.errors.HandlerNotFoundException;
import org.elasticsoftware.eventcore.handling.Handler;
import org.elasticsoftware.eventcore.handling.Middleware;
import org.elasticsoftware.eventcore.handling.Payload;
import org.slf4j.Logger;

import java.util.Arrays;
import java.util.List;

public interface CommandBus {
    /**
     * Routes the command to the handler registered for its type.
     *
     * @throws HandlerNotFoundException when no handler is registered for the command type
     */
    void handle(Logger log, Command command);

    void handle(Logger log, Payload<Command> payload);

    /**
     * Registers the handler for a command type. The first middleware is the outermost layer.
     * Registering the same type again replaces the previous handler.
     */
    void register(String commandType, Handler<Command, Void> handler, List<Middleware<Command, Void>> middleware);

    @SuppressWarnings("unchecked")
    default void register(String commandType, Handler<Command, Void> handler, Middleware<Command, Void>... middleware) {
        register(commandType, handler, Arrays.asList(middleware));
    }

    /**
     * Adds middleware that wraps every handler registered after this call, outside of the
     * middleware passed to {@code register}. Handlers registered earlier are not affected.
     */
    void use(List<Middleware<Command, Void>> middleware);

    @SuppressWarnings("unchecked")
    default void use(Middleware<Command, Void>... middleware) {
        use(Arrays.asList(middleware));
    }
}
