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
package com.tomaszrup.jspls.config;

import java.math.BigDecimal;

import org.eclipse.lsp4j.FormattingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.jspls.formatter.FormatOptions;

/**
 * Immutable snapshot of the {@code jsp.format.*} client settings.
 *
 * <p>{@code tabSize} and {@code insertSpaces} are optional: when the client
 * leaves them unset, the values sent with each formatting request win.</p>
 */
public final class FormatSettings {
	private static final Logger logger = LoggerFactory.getLogger(FormatSettings.class);

	public static final String SECTION = "jsp";
	static final String FORMAT_KEY = "format";
	static final String ENABLE_KEY = "enable";
	static final String TAB_SIZE_KEY = "tabSize";
	static final String INSERT_SPACES_KEY = "insertSpaces";
	static final String PRESERVE_NEWLINES_KEY = "preserveNewlines";
	static final String MAX_PRESERVE_NEWLINES_KEY = "maxPreserveNewlines";
	static final String WRAP_LINE_LENGTH_KEY = "wrapLineLength";

	private static final FormatSettings DEFAULTS = new FormatSettings(true, null, null, true,
			FormatOptions.DEFAULT_MAX_BLANK_LINES, FormatOptions.DEFAULT_WRAP_LINE_LENGTH);

	private final boolean enabled;
	private final Integer tabSize;
	private final Boolean insertSpaces;
	private final boolean preserveNewlines;
	private final int maxPreserveNewlines;
	private final int wrapLineLength;

	public FormatSettings(boolean enabled, Integer tabSize, Boolean insertSpaces, boolean preserveNewlines,
			int maxPreserveNewlines, int wrapLineLength) {
		this.enabled = enabled;
		this.tabSize = tabSize;
		this.insertSpaces = insertSpaces;
		this.preserveNewlines = preserveNewlines;
		this.maxPreserveNewlines = maxPreserveNewlines;
		this.wrapLineLength = wrapLineLength;
	}

	public static FormatSettings defaults() {
		return DEFAULTS;
	}

	/**
	 * Reads the {@code format} object of a {@code jsp} settings section.
	 * Keys that are missing, of the wrong type or out of range keep their
	 * default.
	 *
	 * @param jspSection the value of the {@code jsp} key, may be {@code null}
	 */
	public static FormatSettings fromJson(JsonObject jspSection) {
		if (jspSection == null || !jspSection.has(FORMAT_KEY) || !jspSection.get(FORMAT_KEY).isJsonObject()) {
			return DEFAULTS;
		}
		JsonObject format = jspSection.getAsJsonObject(FORMAT_KEY);
		boolean enabled = readBoolean(format, ENABLE_KEY, DEFAULTS.enabled);
		Integer tabSize = readInt(format, TAB_SIZE_KEY, 1, 16, null);
		Boolean insertSpaces = format.has(INSERT_SPACES_KEY)
				? readBoolean(format, INSERT_SPACES_KEY, null)
				: null;
		boolean preserveNewlines = readBoolean(format, PRESERVE_NEWLINES_KEY, DEFAULTS.preserveNewlines);
		int maxPreserveNewlines = readInt(format, MAX_PRESERVE_NEWLINES_KEY, 0, 100, DEFAULTS.maxPreserveNewlines);
		int wrapLineLength = readInt(format, WRAP_LINE_LENGTH_KEY, 1, 1000, DEFAULTS.wrapLineLength);
		return new FormatSettings(enabled, tabSize, insertSpaces, preserveNewlines, maxPreserveNewlines,
				wrapLineLength);
	}

	private static Boolean readBoolean(JsonObject format, String key, Boolean defaultValue) {
		JsonElement value = format.get(key);
		if (value == null || value.isJsonNull()) {
			return defaultValue;
		}
		if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
			logger.warn("Ignoring setting {}.{}.{}: expected a boolean but got {}", SECTION, FORMAT_KEY, key, value);
			return defaultValue;
		}
		return value.getAsBoolean();
	}

	private static Integer readInt(JsonObject format, String key, int min, int max, Integer defaultValue) {
		JsonElement value = format.get(key);
		if (value == null || value.isJsonNull()) {
			return defaultValue;
		}
		if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
			logger.warn("Ignoring setting {}.{}.{}: expected a number but got {}", SECTION, FORMAT_KEY, key, value);
			return defaultValue;
		}
		BigDecimal number = value.getAsBigDecimal();
		if (number.stripTrailingZeros().scale() > 0) {
			logger.warn("Ignoring setting {}.{}.{}={}: expected a whole number", SECTION, FORMAT_KEY, key, value);
			return defaultValue;
		}
		if (number.compareTo(BigDecimal.valueOf(min)) < 0 || number.compareTo(BigDecimal.valueOf(max)) > 0) {
			logger.warn("Ignoring setting {}.{}.{}={}: outside acceptable range ({}-{})", SECTION, FORMAT_KEY, key,
					value, min, max);
			return defaultValue;
		}
		return number.intValueExact();
	}

	/**
	 * Merges these settings with the options of one formatting request.
	 */
	public FormatOptions toFormatOptions(FormattingOptions requestOptions) {
		int requestTabSize = requestOptions != null && requestOptions.getTabSize() > 0
				? requestOptions.getTabSize()
				: FormatOptions.DEFAULT_INDENT_SIZE;
		boolean requestInsertSpaces = requestOptions == null || requestOptions.isInsertSpaces();
		return new FormatOptions(
				tabSize != null ? tabSize : requestTabSize,
				insertSpaces != null ? insertSpaces : requestInsertSpaces,
				preserveNewlines,
				maxPreserveNewlines,
				wrapLineLength);
	}

	public boolean isEnabled() {
		return enabled;
	}

	public Integer getTabSize() {
		return tabSize;
	}

	public Boolean getInsertSpaces() {
		return insertSpaces;
	}

	public boolean isPreserveNewlines() {
		return preserveNewlines;
	}

	public int getMaxPreserveNewlines() {
		return maxPreserveNewlines;
	}

	public int getWrapLineLength() {
		return wrapLineLength;
	}

	@Override
	public String toString() {
		return "FormatSettings{enabled=" + enabled
				+ ", tabSize=" + tabSize
				+ ", insertSpaces=" + insertSpaces
				+ ", preserveNewlines=" + preserveNewlines
				+ ", maxPreserveNewlines=" + maxPreserveNewlines
				+ ", wrapLineLength=" + wrapLineLength + "}";
	}
}
