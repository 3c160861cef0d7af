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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A pending wait for {@code publishDiagnostics} on one URI. Guarded by the
 * owning client's diagnostics lock.
 */
final class DiagnosticsWaiter {

    final String uri;
    final long minSequence;
    final CompletableFuture<Void> future = new CompletableFuture<>();

    ScheduledFuture<?> timeoutHandle;
    ScheduledFuture<?> debounceHandle;
    Runnable abortCleanup;

    DiagnosticsWaiter(String uri, long minSequence) {
        this.uri = uri;
        this.minSequence = minSequence;
    }

    void release() {
        if (timeoutHandle != null) {
            timeoutHandle.cancel(false);
        }
        if (debounceHandle != null) {
            debounceHandle.cancel(false);
        }
        if (abortCleanup != null) {
            abortCleanup.run();
        }
    }
}
