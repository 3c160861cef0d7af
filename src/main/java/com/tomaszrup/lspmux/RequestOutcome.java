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
 * Result of one operation against one client key.
 *
 * @param <T> value type
 */
public final class RequestOutcome<T> {

    private final String serverId;
    private final String key;
    private final boolean ok;
    private final T value;
    private final LspError error;
    private final boolean timedOut;

    private RequestOutcome(String serverId, String key, boolean ok, T value, LspError error, boolean timedOut) {
        this.serverId = serverId;
        this.key = key;
        this.ok = ok;
        this.value = value;
        this.error = error;
        this.timedOut = timedOut;
    }

    public static <T> RequestOutcome<T> success(String serverId, String key, T value) {
        return new RequestOutcome<>(serverId, key, true, value, null, false);
    }

    public static <T> RequestOutcome<T> failure(String serverId, String key, LspError error) {
        return new RequestOutcome<>(serverId, key, false, null, error,
                LspErrorCode.ETIMEDOUT.name().equals(error.getCode()));
    }

    public String getServerId() {
        return serverId;
    }

    public String getKey() {
        return key;
    }

    public boolean isOk() {
        return ok;
    }

    public T getValue() {
        return value;
    }

    public LspError getError() {
        return error;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
