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
package com.tomaszrup.lspmux.config;

/**
 * Request, diagnostics and initialize budgets, in milliseconds.
 */
public final class TimingConfig {

    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 10_000;
    public static final long DEFAULT_DIAGNOSTICS_WAIT_TIMEOUT_MS = 3_000;
    public static final long DEFAULT_INITIALIZE_TIMEOUT_MS = 15_000;

    private final long requestTimeoutMs;
    private final long diagnosticsWaitTimeoutMs;
    private final long initializeTimeoutMs;

    public TimingConfig(long requestTimeoutMs, long diagnosticsWaitTimeoutMs, long initializeTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
        this.diagnosticsWaitTimeoutMs = diagnosticsWaitTimeoutMs;
        this.initializeTimeoutMs = initializeTimeoutMs;
    }

    public static TimingConfig defaults() {
        return new TimingConfig(DEFAULT_REQUEST_TIMEOUT_MS, DEFAULT_DIAGNOSTICS_WAIT_TIMEOUT_MS,
                DEFAULT_INITIALIZE_TIMEOUT_MS);
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public long getDiagnosticsWaitTimeoutMs() {
        return diagnosticsWaitTimeoutMs;
    }

    public long getInitializeTimeoutMs() {
        return initializeTimeoutMs;
    }
}
