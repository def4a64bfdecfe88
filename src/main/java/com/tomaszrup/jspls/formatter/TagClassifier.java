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
 * Classifies one trimmed skeleton line for the {@link StructuralIndenter}.
 */
public final class TagClassifier {

	public enum LineKind {
		OPENING_TAG,
		CLOSING_TAG,
		SELF_CLOSING_TAG,
		PLAIN_TEXT
	}

	private TagClassifier() {
		// utility class
	}

	public static LineKind classify(String line) {
		if (line.length() < 2 || line.charAt(0) != '<') {
			return LineKind.PLAIN_TEXT;
		}
		if (line.charAt(1) == '/') {
			return classifyClosing(line);
		}
		int nameEnd = scanName(line, 1);
		if (nameEnd == 1) {
			// <!DOCTYPE>, <?xml ?>, stray '<'
			return LineKind.PLAIN_TEXT;
		}
		String name = line.substring(1, nameEnd);
		int tagEnd = findTagEnd(line, nameEnd);
		if (tagEnd < 0) {
			return LineKind.PLAIN_TEXT;
		}
		if (line.charAt(tagEnd - 1) == '/' || TagVocabulary.isVoid(name)) {
			return LineKind.SELF_CLOSING_TAG;
		}
		if (tagEnd == line.length() - 1) {
			return LineKind.OPENING_TAG;
		}
		if (TagVocabulary.isBlockTag(name) && !closesOnSameLine(line, tagEnd + 1, name)) {
			return LineKind.OPENING_TAG;
		}
		return LineKind.PLAIN_TEXT;
	}

	private static LineKind classifyClosing(String line) {
		int nameEnd = scanName(line, 2);
		if (nameEnd == 2) {
			return LineKind.PLAIN_TEXT;
		}
		int i = skipWhitespace(line, nameEnd);
		if (i >= line.length() || line.charAt(i) != '>') {
			return LineKind.PLAIN_TEXT;
		}
		String name = line.substring(2, nameEnd);
		return TagVocabulary.isVoid(name) ? LineKind.PLAIN_TEXT : LineKind.CLOSING_TAG;
	}

	/**
	 * @return the index just past the tag name starting at {@code from}, or
	 *         {@code from} when no name starts there
	 */
	static int scanName(String line, int from) {
		if (from >= line.length() || !isNameStart(line.charAt(from))) {
			return from;
		}
		int i = from + 1;
		while (i < line.length() && isNameChar(line.charAt(i))) {
			i++;
		}
		return i;
	}

	/**
	 * Finds the {@code '>'} ending the tag that starts the line, skipping
	 * quoted attribute values.
	 *
	 * @return its index, or -1 if the tag does not end on this line
	 */
	static int findTagEnd(String line, int from) {
		char quote = 0;
		for (int i = from; i < line.length(); i++) {
			char c = line.charAt(i);
			if (quote != 0) {
				if (c == quote) {
					quote = 0;
				}
			} else if (c == '"' || c == '\'') {
				quote = c;
			} else if (c == '>') {
				return i;
			} else if (c == '<') {
				return -1;
			}
		}
		return -1;
	}

	private static boolean closesOnSameLine(String line, int from, String name) {
		int index = line.indexOf("</" + name, from);
		while (index >= 0) {
			int i = skipWhitespace(line, index + 2 + name.length());
			if (i < line.length() && line.charAt(i) == '>') {
				return true;
			}
			index = line.indexOf("</" + name, index + 1);
		}
		return false;
	}

	private static int skipWhitespace(String line, int from) {
		int i = from;
		while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
			i++;
		}
		return i;
	}

	private static boolean isNameStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == ':';
	}

	private static boolean isNameChar(char c) {
		return isNameStart(c) || (c >= '0' && c <= '9') || c == '-' || c == '_' || c == '.';
	}
}
