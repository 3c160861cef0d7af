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

import java.util.Collections;
import java.util.List;

/**
 * Aggregate of touching one file on every resolved client.
 */
public final class TouchResult {

    private final boolean touched;
    private final boolean timedOut;
    private final boolean aborted;
    private final List<LspError> errors;

    public TouchResult(boolean touched, boolean timedOut, boolean aborted, List<LspError> errors) {
        this.touched = touched;
        this.timedOut = timedOut;
        this.aborted = aborted;
        this.errors = Collections.unmodifiableList(errors);
    }

    /** {@code false} when no client was available. */
    public boolean isTouched() {
        return touched;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isAborted() {
        return aborted;
    }

    public List<LspError> getErrors() {
        return errors;
    }
}
