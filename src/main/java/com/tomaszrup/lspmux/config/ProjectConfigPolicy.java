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
 * Global rule deciding whether project-level configuration may override
 * sensitive server fields ({@code command}, {@code env}).
 */
public enum ProjectConfigPolicy {
    @SerializedName("trusted-only")
    TRUSTED_ONLY("trusted-only"),
    @SerializedName("always")
    ALWAYS("always"),
    @SerializedName("never")
    NEVER("never");

    private final String value;

    ProjectConfigPolicy(String value) {
        this.value = value;
    }

    /** Literal used in the configuration file. */
    public String getValue() {
        return value;
    }

    static ProjectConfigPolicy fromValue(String value) {
        for (ProjectConfigPolicy policy : values()) {
            if (policy.value.equals(value)) {
                return policy;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
