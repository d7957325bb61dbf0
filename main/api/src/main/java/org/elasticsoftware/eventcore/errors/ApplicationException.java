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

public class ApplicationException extends EventCoreException {
    public static final String REQUEST_ERROR = "REQUEST_ERROR";
    public static final String HANDLER_PANIC = "HANDLER_PANIC";

    private final String code;
    private final String reason;

    public ApplicationException(String code, String reason, @Nullable Throwable cause) {
        super(cause != null
                ? code + ": " + reason + " (caused by: " + cause.getMessage() + ")"
                : code + ": " + reason, cause);
        this.code = code;
        this.reason = reason;
    }

    public ApplicationException(String code, String reason) {
        this(code, reason, null);
    }

    public String getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }
}
