////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspmux;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry delay for broken (server, root) pairs: exponential from 5 s, capped
 * at 60 s, with +/-20% jitter and a 1 s floor.
 */
public class BackoffPolicy {

    static final long BASE_DELAY_MS = 5_000;
    static final long CAP_DELAY_MS = 60_000;
    static final long MIN_DELAY_MS = 1_000;

    private final DoubleSupplier jitter;

    public BackoffPolicy() {
        this(() -> 0.8 + ThreadLocalRandom.current().nextDouble() * 0.4);
    }

    /**
     * @param jitter supplies the jitter factor, expected in {@code [0.8, 1.2]}
     */
    public BackoffPolicy(DoubleSupplier jitter) {
        this.jitter = jitter;
    }

    public long delayMs(int attempts) {
        int exponent = Math.min(Math.max(0, attempts - 1), 30);
        long exponential = Math.min(CAP_DELAY_MS, BASE_DELAY_MS << exponent);
        return Math.max(MIN_DELAY_MS, Math.round(exponential * jitter.getAsDouble()));
    }
}
