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

/** Outcome of {@link LspClient#touchFile}. */
public final class TouchFileResult {

    private static final TouchFileResult OK = new TouchFileResult(false, false);
    private static final TouchFileResult TIMED_OUT = new TouchFileResult(true, false);
    private static final TouchFileResult ABORTED = new TouchFileResult(false, true);

    private final boolean timedOut;
    private final boolean aborted;

    private TouchFileResult(boolean timedOut, boolean aborted) {
        this.timedOut = timedOut;
        this.aborted = aborted;
    }

    public static TouchFileResult ok() {
        return OK;
    }

    public static TouchFileResult timedOut() {
        return TIMED_OUT;
    }

    public static TouchFileResult aborted() {
        return ABORTED;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isAborted() {
        return aborted;
    }
}
