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
package com.tomaszrup.lspmux.client;

/**
 * Per-request overrides. A {@code null} timeout means the client's default
 * request timeout.
 */
public final class RequestOptions {

    private static final RequestOptions DEFAULTS = new RequestOptions(null, null);

    private final Long timeoutMs;
    private final AbortSignal signal;

    private RequestOptions(Long timeoutMs, AbortSignal signal) {
        this.timeoutMs = timeoutMs;
        this.signal = signal;
    }

    public static RequestOptions defaults() {
        return DEFAULTS;
    }

    public static RequestOptions of(Long timeoutMs, AbortSignal signal) {
        return new RequestOptions(timeoutMs, signal);
    }

    public static RequestOptions withTimeout(long timeoutMs) {
        return new RequestOptions(timeoutMs, null);
    }

    public static RequestOptions withSignal(AbortSignal signal) {
        return new RequestOptions(null, signal);
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public AbortSignal getSignal() {
        return signal;
    }
}
