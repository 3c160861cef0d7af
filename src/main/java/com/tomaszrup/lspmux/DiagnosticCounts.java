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

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;

import java.util.Collection;

/**
 * Diagnostic totals by severity. A missing severity counts as info.
 */
public final class DiagnosticCounts {

    private final int error;
    private final int warning;
    private final int info;
    private final int hint;
    private final int total;

    private DiagnosticCounts(int error, int warning, int info, int hint, int total) {
        this.error = error;
        this.warning = warning;
        this.info = info;
        this.hint = hint;
        this.total = total;
    }

    public static DiagnosticCounts of(Collection<Diagnostic> diagnostics) {
        int error = 0;
        int warning = 0;
        int info = 0;
        int hint = 0;
        for (Diagnostic diagnostic : diagnostics) {
            DiagnosticSeverity severity = diagnostic.getSeverity();
            if (severity == DiagnosticSeverity.Error) {
                error++;
            } else if (severity == DiagnosticSeverity.Warning) {
                warning++;
            } else if (severity == DiagnosticSeverity.Hint) {
                hint++;
            } else {
                info++;
            }
        }
        return new DiagnosticCounts(error, warning, info, hint, diagnostics.size());
    }

    public int getError() {
        return error;
    }

    public int getWarning() {
        return warning;
    }

    public int getInfo() {
        return info;
    }

    public int getHint() {
        return hint;
    }

    public int getTotal() {
        return total;
    }
}
