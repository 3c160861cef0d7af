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
import java.util.Map;

/**
 * Failure raised by the spawner and protocol client. Futures are completed
 * exceptionally with this type; {@link OutcomeErrors} turns it into an
 * {@link LspError}.
 */
public class LspException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final LspErrorCode code;
    private final String serverId;
    private final String root;
    private final List<String> command;
    private final Map<String, Object> details;
    private final String responseCode;

    public LspException(LspErrorCode code, String message) {
        this(code, message, null, null, null, null, null, null);
    }

    public LspException(LspErrorCode code, String message, Throwable cause) {
        this(code, message, null, null, null, null, null, cause);
    }

    public LspException(LspErrorCode code, String message, String serverId, String root,
                        List<String> command, Map<String, Object> details, String responseCode,
                        Throwable cause) {
        super(message, cause);
        this.code = code;
        this.serverId = serverId;
        this.root = root;
        this.command = command != null ? Collections.unmodifiableList(command) : null;
        this.details = details != null ? Collections.unmodifiableMap(details) : null;
        this.responseCode = responseCode;
    }

    public LspErrorCode getCode() {
        return code;
    }

    public String getServerId() {
        return serverId;
    }

    public String getRoot() {
        return root;
    }

    /** Command that was (or would have been) launched, if known. */
    public List<String> getCommand() {
        return command;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * {@code LSP_<n>} for JSON-RPC error responses, otherwise {@code null}.
     */
    public String getResponseCode() {
        return responseCode;
    }

    /** Code as reported to callers: the response code when present, else the enum name. */
    public String getReportedCode() {
        return responseCode != null ? responseCode : code.name();
    }

    public boolean isTimedOut() {
        return code == LspErrorCode.ETIMEDOUT;
    }
}
