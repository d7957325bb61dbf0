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

package org.elasticsoftware.eventcore.errors;

import org.elasticsoftware.eventcore.EventCoreException;
import org.elasticsoftware.eventcore.handling.RequestKind;

public class HandlerNotFoundException extends EventCoreException {
    private final String type;
    private final RequestKind kind;

    public HandlerNotFoundException(String type, RequestKind kind) {
        super("no " + kind.label() + " handler registered for type: " + type);
        this.type = type;
        this.kind = kind;
    }

    public String getType() {
        return type;
    }

    public RequestKind getKind() {
        return kind;
    }
}
