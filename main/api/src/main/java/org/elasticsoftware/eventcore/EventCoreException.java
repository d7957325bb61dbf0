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

package org.elasticsoftware.eventcore;

/**
 * Base type of every error raised by EventCore. All of them are unchecked; callers decide which
 * ones to handle, the error handling middleware treats every subclass as a known error kind.
 */
public abstract class EventCoreException extends RuntimeException {

    protected EventCoreException(String message) {
        super(message);
    }

    protected EventCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
