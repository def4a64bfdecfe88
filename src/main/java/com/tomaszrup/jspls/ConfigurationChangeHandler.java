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
 * Turns {@code workspace/didChangeConfiguration} payloads into
 * {@link FormatSettings} snapshots.
 */
final class ConfigurationChangeHandler {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationChangeHandler.class);

    /**
     * Receives the new settings after every accepted configuration change.
     */
    @FunctionalInterface
    public interface SettingsChangeListener {
        void onSettingsChanged(FormatSettings settings);
    }

    private final SettingsChangeListener settingsChangeListener;

    ConfigurationChangeHandler(SettingsChangeListener settingsChangeListener) {
        this.settingsChangeListener = settingsChangeListener;
    }

    /**
     * Processes a didChangeConfiguration notification. Payloads without a
     * {@code jsp} object leave the current settings alone.
     *
     * @param rawSettings the raw settings object from the LSP params
     */
    void handleConfigurationChange(Object rawSettings) {
        if (!(rawSettings instanceof JsonObject)) {
            logger.debug("Ignoring configuration change without a settings object: {}", rawSettings);
            return;
        }
        JsonElement jsp = ((JsonObject) rawSettings).get(FormatSettings.SECTION);
        if (jsp == null || !jsp.isJsonObject()) {
            return;
        }
        FormatSettings settings = FormatSettings.fromJson(jsp.getAsJsonObject());
        logger.info("Format settings changed: {}", settings);
        settingsChangeListener.onSettingsChanged(settings);
    }
}
