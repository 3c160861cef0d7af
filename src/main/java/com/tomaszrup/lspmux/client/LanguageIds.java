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

import java.nio.file.Path;
import java.util.Locale;

/**
 * {@code languageId} values sent with {@code textDocument/didOpen}.
 */
public final class LanguageIds {

    private LanguageIds() {
    }

    public static String infer(Path file) {
        Path fileName = file.getFileName();
        String name = fileName != null ? fileName.toString().toLowerCase(Locale.ROOT) : "";
        int dot = name.lastIndexOf('.');
        String extension = dot > 0 ? name.substring(dot + 1) : "";
        switch (extension) {
            case "ts":
                return "typescript";
            case "tsx":
                return "typescriptreact";
            case "js":
                return "javascript";
            case "jsx":
                return "javascriptreact";
            case "py":
                return "python";
            case "rs":
                return "rust";
            case "go":
                return "go";
            case "java":
                return "java";
            case "c":
                return "c";
            case "cpp":
            case "cc":
                return "cpp";
            default:
                return extension.isEmpty() ? "plaintext" : extension;
        }
    }
}
