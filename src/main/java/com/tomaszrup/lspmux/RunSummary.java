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

import com.tomaszrup.lspmux.config.LoadWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All outcomes of one fan-out. {@code hits} counts the client keys the
 * operation targeted; zero means no server was available.
 *
 * @param <T> value type
 */
public final class RunSummary<T> {

    private final int hits;
    private final List<RequestOutcome<T>> outcomes;
    private final List<LoadWarning> warnings;

    public RunSummary(int hits, List<RequestOutcome<T>> outcomes, List<LoadWarning> warnings) {
        this.hits = hits;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public int getHits() {
        return hits;
    }

    public List<RequestOutcome<T>> getOutcomes() {
        return outcomes;
    }

    public List<LoadWarning> getWarnings() {
        return warnings;
    }

    public boolean anyOk() {
        return outcomes.stream().anyMatch(RequestOutcome::isOk);
    }

    public List<LspError> getErrors() {
        List<LspError> errors = new ArrayList<>();
        for (RequestOutcome<T> outcome : outcomes) {
            if (!outcome.isOk()) {
                errors.add(outcome.getError());
            }
        }
        return errors;
    }
}
