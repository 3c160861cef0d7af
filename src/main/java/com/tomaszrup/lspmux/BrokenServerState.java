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

/**
 * Backoff bookkeeping for one client key.
 */
public final class BrokenServerState {

    private final int attempts;
    private final long retryAt;
    private final String lastError;

    public BrokenServerState(int attempts, long retryAt, String lastError) {
        this.attempts = attempts;
        this.retryAt = retryAt;
        this.lastError = lastError;
    }

    public int getAttempts() {
        return attempts;
    }

    /** Epoch millis before which the key is skipped. */
    public long getRetryAt() {
        return retryAt;
    }

    public String getLastError() {
        return lastError;
    }

    public boolean isBackingOff(long nowMs) {
        return nowMs < retryAt;
    }
}
