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
package com.tomaszrup.jspls.formatter;

/**
 * Immutable options for one formatting invocation.
 *
 * <p>{@code wrapLineLength} is carried for clients that configure it but is
 * not enforced by any formatting stage yet.</p>
 */
public final class FormatOptions {

	public static final int DEFAULT_INDENT_SIZE = 4;
	public static final int DEFAULT_MAX_BLANK_LINES = 2;
	public static final int DEFAULT_WRAP_LINE_LENGTH = 120;

	private final int indentSize;
	private final boolean insertSpaces;
	private final boolean preserveBlankLines;
	private final int maxBlankLines;
	private final int wrapLineLength;

	public FormatOptions(int indentSize, boolean insertSpaces, boolean preserveBlankLines,
			int maxBlankLines, int wrapLineLength) {
		if (indentSize <= 0) {
			throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
		}
		if (maxBlankLines < 0) {
			throw new IllegalArgumentException("maxBlankLines must not be negative: " + maxBlankLines);
		}
		if (wrapLineLength <= 0) {
			throw new IllegalArgumentException("wrapLineLength must be positive: " + wrapLineLength);
		}
		this.indentSize = indentSize;
		this.insertSpaces = insertSpaces;
		this.preserveBlankLines = preserveBlankLines;
		this.maxBlankLines = maxBlankLines;
		this.wrapLineLength = wrapLineLength;
	}

	/**
	 * Options with the given indentation and default blank-line and wrap
	 * settings.
	 */
	public static FormatOptions of(int indentSize, boolean insertSpaces) {
		return new FormatOptions(indentSize, insertSpaces, true, DEFAULT_MAX_BLANK_LINES,
				DEFAULT_WRAP_LINE_LENGTH);
	}

	public static FormatOptions defaults() {
		return of(DEFAULT_INDENT_SIZE, true);
	}

	public int getIndentSize() {
		return indentSize;
	}

	public boolean isInsertSpaces() {
		return insertSpaces;
	}

	public boolean isPreserveBlankLines() {
		return preserveBlankLines;
	}

	public int getMaxBlankLines() {
		return maxBlankLines;
	}

	public int getWrapLineLength() {
		return wrapLineLength;
	}

	/**
	 * One level of indentation: {@code indentSize} spaces, or a single tab.
	 */
	public String indentUnit() {
		return insertSpaces ? " ".repeat(indentSize) : "\t";
	}

	@Override
	public String toString() {
		return "FormatOptions{indentSize=" + indentSize
				+ ", insertSpaces=" + insertSpaces
				+ ", preserveBlankLines=" + preserveBlankLines
				+ ", maxBlankLines=" + maxBlankLines
				+ ", wrapLineLength=" + wrapLineLength + "}";
	}
}
