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
 * Structured failure codes reported per server outcome.
 */
public enum LspErrorCode {
    /** The server process could not be started (missing binary, launch failure). */
    ESPAWN,
    /** The {@code initialize} handshake failed. */
    EINIT,
    /** A request or diagnostics wait exceeded its budget. */
    ETIMEDOUT,
    /** The server process exited or its stream closed. */
    EPIPE,
    /** The (server, root) pair is backing off after earlier failures. */
    EBROKEN,
    /** The caller cancelled the operation. */
    EABORTED,
    /** The server answered with a JSON-RPC error. */
    ERESPONSE,
    /** Anything else. */
    EINTERNAL
}
