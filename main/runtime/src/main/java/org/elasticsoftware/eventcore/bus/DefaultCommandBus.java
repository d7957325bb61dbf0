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

package org.elasticsoftware.eventcore.bus;

import org.elasticsoftware.eventcore.commands.Command;
import org.elasticsoftware.eventcore.commands.CommandBus;
import org.elasticsoftware.eventcore.handling.Payload;
import org.elasticsoftware.eventcore.handling.RequestKind;
import org.elasticsoftware.eventcore.handling.RequestType;
import org.slf4j.Logger;

import java.util.Objects;

public class DefaultCommandBus extends AbstractBus<Command, Void> implements CommandBus {

    public DefaultCommandBus() {
        super(RequestKind.COMMAND);
    }

    @Override
    public void handle(Logger log, Command command) {
        Objects.requireNonNull(command, "command");
        handle(log, createPayload(RequestType.of(command), command));
    }

    @Override
    public void handle(Logger log, Payload<Command> payload) {
        dispatch(log, payload);
    }
}
