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
package com.tomaszrup.jspls;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.jspls.config.FormatSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the {@code initializationOptions} JSON object sent by the client
 * during the LSP {@code initialize} request.
 *
 * <p>Recognized keys: {@code logLevel} and a {@code jsp} object shaped like
 * the workspace settings ({@code jsp.format.*}).</p>
 */
class InitializationOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

    static final String LOG_LEVEL_OPTION = "logLevel";

    private InitializationOptionsParser() {
        // utility class
    }

    /** Immutable container for parsed initialization options. */
    static final class ParsedOptions {
        final String logLevel;
        final FormatSettings formatSettings;

        ParsedOptions(String logLevel, FormatSettings formatSettings) {
            this.logLevel = logLevel;
            this.formatSettings = formatSettings;
        }
    }

    /**
     * Parse initialization options and apply the log level they name.
     *
     * @return parsed options, or {@code null} if the input is not a
     *         {@link JsonObject}
     */
    static ParsedOptions parse(Object initOptions) {
        if (!(initOptions instanceof JsonObject)) {
            return null;
        }
        JsonObject opts = (JsonObject) initOptions;

        String logLevel = null;
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            logLevel = opts.get(LOG_LEVEL_OPTION).getAsString();
            applyLogLevel(logLevel);
        }

        FormatSettings formatSettings = null;
        JsonElement jsp = opts.get(FormatSettings.SECTION);
        if (jsp != null && jsp.isJsonObject()) {
            formatSettings = FormatSettings.fromJson(jsp.getAsJsonObject());
            logger.info("Initial format settings: {}", formatSettings);
        }
        return new ParsedOptions(logLevel, formatSettings);
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return;
        }
        org.slf4j.Logger rootLogger = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(rootLogger instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Cannot set log level to '{}': logging backend is not Logback", levelName);
            return;
        }
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) rootLogger;
        ch.qos.logback.classic.Level previous = root.getLevel();
        root.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
    }
}
