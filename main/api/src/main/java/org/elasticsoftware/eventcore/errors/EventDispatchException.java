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

import java.util.List;

/**
 * Collects the failures of every event handler that failed during a single dispatch. The
 * individual failures are available as suppressed exceptions and through {@link #getFailures()}.
 */
public class EventDispatchException extends EventCoreException {
    private final List<Exception> failures;

    public EventDispatchException(List<Exception> failures) {
        super("dispatch errors: " + failures.size() + " handler(s) failed", failures.isEmpty() ? null : failures.get(0));
        this.failures = List.copyOf(failures);
        failures.stream().skip(1).forEach(this::addSuppressed);
    }

    public List<Exception> getFailures() {
        return failures;
    }
}
