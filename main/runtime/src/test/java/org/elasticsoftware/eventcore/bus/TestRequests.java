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
import org.elasticsoftware.eventcore.errors.ValidationException;
import org.elasticsoftware.eventcore.handling.Validatable;
import org.elasticsoftware.eventcore.queries.Query;

final class TestRequests {
    private TestRequests() {
    }

    record DepositCommand(String walletId, long amount) implements Command, Validatable {
        @Override
        public String getCommandType() {
            return "Deposit";
        }

        @Override
        public void validate() {
            if (amount <= 0) {
                throw new ValidationException("amount", "must be positive");
            }
        }
    }

    record GetBalanceQuery(String walletId) implements Query {
        @Override
        public String getQueryType() {
            return "GetBalance";
        }
    }
}
