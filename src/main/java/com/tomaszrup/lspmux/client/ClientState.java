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

/**
 * Lifecycle of an {@link LspClient}. {@link #CLOSED} is terminal and can be
 * reached from every state.
 */
public enum ClientState {
    SPAWNED,
    INITIALIZING,
    READY,
    SHUTTING_DOWN,
    CLOSED;

    boolean canTransitionTo(ClientState next) {
        if (next == CLOSED) {
            return this != CLOSED;
        }
        switch (this) {
            case SPAWNED:
                return next == INITIALIZING || next == SHUTTING_DOWN;
            case INITIALIZING:
                return next == READY || next == SHUTTING_DOWN;
            case READY:
                return next == SHUTTING_DOWN;
            default:
                return false;
        }
    }
}
