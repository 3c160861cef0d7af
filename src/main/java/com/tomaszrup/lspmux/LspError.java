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
 * Structured error attached to a failed outcome.
 */
public final class LspError {

    private final String serverId;
    private final String code;
    private final String message;

    public LspError(String serverId, String code, String message) {
        this.serverId = serverId;
        this.code = code;
        this.message = message;
    }

    public String getServerId() {
        return serverId;
    }

    /** An {@link LspErrorCode} name or {@code LSP_<n>}. */
    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return serverId + " [" + code + "] " + message;
    }
}
