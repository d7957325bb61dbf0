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

/**
 * Raised when the sequence number a writer based its changes on no longer matches the stored one.
 * The caller is expected to reload the aggregate and retry.
 */
public class ConcurrencyException extends EventCoreException {
    private final String aggregateId;
    private final long expectedSequenceNo;
    private final long actualSequenceNo;

    public ConcurrencyException(String aggregateId, long expectedSequenceNo, long actualSequenceNo) {
        super("concurrency error for aggregate " + aggregateId + ": expected version "
                + expectedSequenceNo + ", got " + actualSequenceNo);
        this.aggregateId = aggregateId;
        this.expectedSequenceNo = expectedSequenceNo;
        this.actualSequenceNo = actualSequenceNo;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedSequenceNo() {
        return expectedSequenceNo;
    }

    public long getActualSequenceNo() {
        return actualSequenceNo;
    }
}
