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

import jakarta.annotation.Nullable;
import org.elasticsoftware.eventcore.EventCoreException;

public class ValidationException extends EventCoreException {
    private final String field;
    private final String reason;

    public ValidationException(@Nullable String field, String reason) {
        super(field != null && !field.isEmpty()
                ? "validation error on field '" + field + "': " + reason
                : "validation error: " + reason);
        this.field = field;
        this.reason = reason;
    }

    public ValidationException(String reason) {
        this(null, reason);
    }

    @Nullable
    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
