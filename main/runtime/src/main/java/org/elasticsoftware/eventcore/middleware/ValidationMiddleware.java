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

package org.elasticsoftware.eventcore.middleware;

import org.elasticsoftware.eventcore.errors.ValidationException;
import org.elasticsoftware.eventcore.handling.Handler;
import org.elasticsoftware.eventcore.handling.Middleware;
import org.elasticsoftware.eventcore.handling.Response;
import org.elasticsoftware.eventcore.handling.Validatable;

/**
 * Calls {@link Validatable#validate()} on requests that support it. An invalid request never
 * reaches the next handler; the returned response carries the {@link ValidationException}.
 */
public class ValidationMiddleware<Q, R> implements Middleware<Q, R> {
    public static final String VALIDATION_FAILED = "validation_failed";

    @Override
    public Handler<Q, R> apply(Handler<Q, R> next) {
        return (log, payload) -> {
            if (payload.data() instanceof Validatable validatable) {
                try {
                    validatable.validate();
                } catch (RuntimeException e) {
                    ValidationException error = toValidationException(e);
                    log.debug("Rejected {} {}: {}", payload.type().kind().label(), payload.type().name(), error.getMessage());
                    return Response.<R>failure(error).withMetadata(VALIDATION_FAILED, true);
                }
            }
            return next.handle(log, payload);
        };
    }

    private static ValidationException toValidationException(RuntimeException e) {
        if (e instanceof ValidationException validationException) {
            return validationException;
        }
        ValidationException wrapped = new ValidationException(String.valueOf(e.getMessage()));
        wrapped.initCause(e);
        return wrapped;
    }
}
