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

import java.util.Collections;
import java.util.List;

/**
 * Normalized security block. Trust policy and trusted roots always come from
 * the global configuration file.
 */
public final class SecurityConfig {

    private final ProjectConfigPolicy projectConfigPolicy;
    private final List<String> trustedProjectRoots;
    private final boolean allowExternalPaths;

    public SecurityConfig(ProjectConfigPolicy projectConfigPolicy, List<String> trustedProjectRoots,
                          boolean allowExternalPaths) {
        this.projectConfigPolicy = projectConfigPolicy;
        this.trustedProjectRoots = Collections.unmodifiableList(trustedProjectRoots);
        this.allowExternalPaths = allowExternalPaths;
    }

    public static SecurityConfig defaults() {
        return new SecurityConfig(ProjectConfigPolicy.TRUSTED_ONLY, Collections.emptyList(), false);
    }

    public ProjectConfigPolicy getProjectConfigPolicy() {
        return projectConfigPolicy;
    }

    public List<String> getTrustedProjectRoots() {
        return trustedProjectRoots;
    }

    public boolean isAllowExternalPaths() {
        return allowExternalPaths;
    }
}
