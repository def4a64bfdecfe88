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

import java.util.regex.Pattern;

/**
 * Puts protected regions back into the indented skeleton and normalizes
 * blank lines and the end of the document.
 */
public class Reassembler {

	private final FormatOptions options;

	public Reassembler(FormatOptions options) {
		this.options = options;
	}

	public String reassemble(String indented, PlaceholderTable table) {
		String text = table.restore(indented);
		if (options.isPreserveBlankLines()) {
			text = capBlankLines(text, options.getMaxBlankLines());
		}
		return endWithSingleNewline(text);
	}

	/**
	 * Drops trailing whitespace and terminates the text with one newline.
	 * Empty text stays empty.
	 */
	static String endWithSingleNewline(String text) {
		int end = text.length();
		while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
			end--;
		}
		if (end == 0) {
			return text.isEmpty() ? "" : "\n";
		}
		return text.substring(0, end) + "\n";
	}

	/**
	 * Shortens every run of more than {@code maxBlankLines} empty lines to
	 * exactly {@code maxBlankLines}.
	 */
	static String capBlankLines(String text, int maxBlankLines) {
		Pattern excess = Pattern.compile("\n{" + (maxBlankLines + 2) + ",}");
		return excess.matcher(text).replaceAll("\n".repeat(maxBlankLines + 1));
	}
}
