////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;

/**
 * Conversions between LSP positions and string offsets. Lines are split on
 * {@code '\n'}; a {@code '\r'} before it is never counted as a character of
 * the line.
 */
public class Positions {
	private Positions() {
	}

	/**
	 * Returns the offset of {@code position} in {@code string}, or -1 when
	 * the line does not exist or the column lies past the end of the line.
	 * The end of a line is a valid column.
	 */
	public static int getOffset(String string, Position position) {
		if (string == null || position == null || position.getLine() < 0 || position.getCharacter() < 0) {
			return -1;
		}
		int lineStart = 0;
		for (int line = 0; line < position.getLine(); line++) {
			int newline = string.indexOf('\n', lineStart);
			if (newline < 0) {
				return -1;
			}
			lineStart = newline + 1;
		}
		int lineEnd = lineStart;
		while (lineEnd < string.length() && string.charAt(lineEnd) != '\n' && string.charAt(lineEnd) != '\r') {
			lineEnd++;
		}
		int offset = lineStart + position.getCharacter();
		return offset <= lineEnd ? offset : -1;
	}

	/**
	 * Returns the position of {@code offset} in {@code string}. Offsets past
	 * the end are clamped to the end of the text.
	 */
	public static Position getPosition(String string, int offset) {
		int end = Math.max(0, Math.min(offset, string.length()));
		int line = 0;
		int lineStart = 0;
		for (int i = string.indexOf('\n'); i >= 0 && i < end; i = string.indexOf('\n', i + 1)) {
			line++;
			lineStart = i + 1;
		}
		return new Position(line, end - lineStart);
	}

	public static Position documentEnd(String string) {
		return getPosition(string, string.length());
	}
}
