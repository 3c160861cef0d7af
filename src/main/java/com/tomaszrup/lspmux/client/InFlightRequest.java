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

import com.google.gson.JsonElement;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Bookkeeping for one outstanding request. Whoever removes the entry from
 * the client's in-flight map owns completing it and must call {@link #release()}.
 */
final class InFlightRequest {

    private final int id;
    private final String method;
    private final CompletableFuture<JsonElement> future;

    private ScheduledFuture<?> timeoutHandle;
    private Runnable abortCleanup;
    private boolean released;

    InFlightRequest(int id, String method, CompletableFuture<JsonElement> future) {
        this.id = id;
        this.method = method;
        this.future = future;
    }

    int getId() {
        return id;
    }

    String getMethod() {
        return method;
    }

    CompletableFuture<JsonElement> getFuture() {
        return future;
    }

    synchronized void setTimeoutHandle(ScheduledFuture<?> handle) {
        if (released) {
            handle.cancel(false);
        } else {
            this.timeoutHandle = handle;
        }
    }

    synchronized void setAbortCleanup(Runnable cleanup) {
        if (released) {
            cleanup.run();
        } else {
            this.abortCleanup = cleanup;
        }
    }

    /** Cancel the timer and unregister the abort listener. Idempotent. */
    synchronized void release() {
        released = true;
        if (timeoutHandle != null) {
            timeoutHandle.cancel(false);
            timeoutHandle = null;
        }
        if (abortCleanup != null) {
            abortCleanup.run();
            abortCleanup = null;
        }
    }
}
