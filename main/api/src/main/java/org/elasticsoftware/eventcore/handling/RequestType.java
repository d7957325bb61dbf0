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

package org.elasticsoftware.eventcore.handling;

import org.elasticsoftware.eventcore.commands.Command;
import org.elasticsoftware.eventcore.queries.Query;

import java.util.Objects;

/**
 * The routing tag of a request together with its kind. The bus resolves it once when a request
 * enters and carries it in the {@link Payload}, so middleware never has to inspect the request
 * class to find out what it is handling.
 */
public record RequestType(RequestKind kind, String name) {

    public RequestType {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    public static RequestType of(Command command) {
        return new RequestType(RequestKind.COMMAND, command.getCommandType());
    }

    public static RequestType of(Query query) {
        return new RequestType(RequestKind.QUERY, query.getQueryType());
    }

    public boolean isCommand() {
        return kind == RequestKind.COMMAND;
    }

    public boolean isQuery() {
        return kind == RequestKind.QUERY;
    }

    @Override
    public String toString() {
        return kind.label() + ":" + name;
    }
}
