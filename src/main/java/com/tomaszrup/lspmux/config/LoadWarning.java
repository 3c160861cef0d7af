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
 * Non-fatal problem found while loading configuration. Warnings never abort
 * loading; the offending contribution is dropped instead.
 */
public final class LoadWarning {

    public enum Type {
        @SerializedName("project-override-blocked")
        PROJECT_OVERRIDE_BLOCKED("project-override-blocked"),
        @SerializedName("project-security-override-blocked")
        PROJECT_SECURITY_OVERRIDE_BLOCKED("project-security-override-blocked"),
        @SerializedName("invalid-trust-entry")
        INVALID_TRUST_ENTRY("invalid-trust-entry"),
        @SerializedName("project-config-untrusted")
        PROJECT_CONFIG_UNTRUSTED("project-config-untrusted"),
        @SerializedName("trust-matcher-error")
        TRUST_MATCHER_ERROR("trust-matcher-error"),
        @SerializedName("config-parse")
        CONFIG_PARSE("config-parse");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    private final Type type;
    private final String message;
    private final String filePath;
    private final String serverId;
    private final String field;

    public LoadWarning(Type type, String message, String filePath, String serverId, String field) {
        this.type = type;
        this.message = message;
        this.filePath = filePath;
        this.serverId = serverId;
        this.field = field;
    }

    public static LoadWarning of(Type type, String message) {
        return new LoadWarning(type, message, null, null, null);
    }

    public Type getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    /** Configuration file the warning refers to, or {@code null}. */
    public String getFilePath() {
        return filePath;
    }

    public String getServerId() {
        return serverId;
    }

    /** Name of the blocked field, or {@code null}. */
    public String getField() {
        return field;
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
