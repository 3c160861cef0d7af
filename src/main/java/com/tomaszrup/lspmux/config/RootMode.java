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

import com.google.gson.annotations.SerializedName;

/**
 * How a server's root is chosen when none of its root markers match.
 */
public enum RootMode {
    /** Fall back to the workspace root (or the file's directory outside it). */
    @SerializedName("workspace-or-marker")
    WORKSPACE_OR_MARKER("workspace-or-marker"),
    /** Only a matching marker yields a root; otherwise the server is skipped. */
    @SerializedName("marker-only")
    MARKER_ONLY("marker-only");

    private final String value;

    RootMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    static RootMode fromValue(String value) {
        for (RootMode mode : values()) {
            if (mode.value.equals(value)) {
                return mode;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
