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

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * {@code serverId::root} identity of one server instance.
 */
final class ClientKey {

    static final String SEPARATOR = "::";

    private ClientKey() {
    }

    static String of(String serverId, Path root) {
        return serverId + SEPARATOR + root;
    }

    static String serverId(String key) {
        int index = key.indexOf(SEPARATOR);
        return index < 0 ? key : key.substring(0, index);
    }

    static Path root(String key) {
        int index = key.indexOf(SEPARATOR);
        return Paths.get(index < 0 ? "" : key.substring(index + SEPARATOR.length()));
    }
}
