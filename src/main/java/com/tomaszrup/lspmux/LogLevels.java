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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * Runtime control of the Logback root level.
 */
public final class LogLevels {

    private static final Logger logger = LoggerFactory.getLogger(LogLevels.class);

    private LogLevels() {
    }

    /**
     * Set the root logger level by name ({@code TRACE} .. {@code OFF}).
     *
     * @return {@code false} when the name is unknown or Logback is not the
     *         active backend; the current level is kept
     */
    public static boolean apply(String levelName) {
        Level level = Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return false;
        }
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (!(root instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Cannot set log level to '{}': logging backend is {}", levelName, root.getClass().getName());
            return false;
        }
        ch.qos.logback.classic.Logger logbackRoot = (ch.qos.logback.classic.Logger) root;
        Level previous = logbackRoot.getLevel();
        logbackRoot.setLevel(level);
        logger.debug("Log level changed from {} to {}", previous, level);
        return true;
    }
}
