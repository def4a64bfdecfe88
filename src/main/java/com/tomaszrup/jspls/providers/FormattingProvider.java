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
package com.tomaszrup.jspls.providers;

import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.jspls.formatter.FormatOptions;
import com.tomaszrup.jspls.formatter.JspFormatter;
import com.tomaszrup.lsp.utils.Positions;

/**
 * Turns {@link JspFormatter} output into LSP text edits.
 *
 * <p>Both operations compare against the line-ending normalized source and
 * return an empty list when formatting would not change it.</p>
 */
public class FormattingProvider {
	private static final Logger logger = LoggerFactory.getLogger(FormattingProvider.class);

	private final JspFormatter formatter;

	public FormattingProvider() {
		this(new JspFormatter());
	}

	public FormattingProvider(JspFormatter formatter) {
		this.formatter = formatter;
	}

	/**
	 * Formats a whole document into at most one edit spanning it.
	 */
	public List<TextEdit> provideFormatting(String sourceText, FormatOptions options) {
		if (sourceText == null || sourceText.isEmpty()) {
			return Collections.emptyList();
		}
		String normalizedSource = JspFormatter.normalizeLineEndings(sourceText);
		String formattedText = formatter.format(normalizedSource, options);
		if (formattedText.equals(normalizedSource)) {
			return Collections.emptyList();
		}
		return Collections.singletonList(new TextEdit(
				new Range(new Position(0, 0), Positions.documentEnd(normalizedSource)),
				formattedText));
	}

	/**
	 * Formats the text inside {@code range} into at most one edit over that
	 * range. The fragment keeps the indentation of its first line, and a
	 * fragment that did not end with a newline gets none appended. Line
	 * endings are normalized before comparing, as for whole documents.
	 *
	 * @return no edits when the range does not fit the document
	 */
	public List<TextEdit> provideRangeFormatting(String sourceText, Range range, FormatOptions options) {
		if (sourceText == null || range == null) {
			return Collections.emptyList();
		}
		int start = Positions.getOffset(sourceText, range.getStart());
		int end = Positions.getOffset(sourceText, range.getEnd());
		if (start < 0 || end < start) {
			logger.debug("Ignoring range formatting for invalid range {}", range);
			return Collections.emptyList();
		}
		String fragment = JspFormatter.normalizeLineEndings(sourceText.substring(start, end));
		if (fragment.isBlank()) {
			return Collections.emptyList();
		}

		int lineStart = sourceText.lastIndexOf('\n', start - 1) + 1;
		String baseIndent = leadingIndentation(sourceText, lineStart);
		String formatted = formatter.format(fragment, options);
		if (start == lineStart) {
			formatted = indentFragment(formatted, baseIndent, true);
		} else if (start == lineStart + baseIndent.length()) {
			formatted = indentFragment(formatted, baseIndent, false);
		}
		if (!fragment.endsWith("\n") && formatted.endsWith("\n")) {
			formatted = formatted.substring(0, formatted.length() - 1);
		}
		if (formatted.equals(fragment)) {
			return Collections.emptyList();
		}
		return Collections.singletonList(new TextEdit(range, formatted));
	}

	static String leadingIndentation(String sourceText, int lineStart) {
		int indentEnd = lineStart;
		while (indentEnd < sourceText.length()
				&& (sourceText.charAt(indentEnd) == ' ' || sourceText.charAt(indentEnd) == '\t')) {
			indentEnd++;
		}
		return sourceText.substring(lineStart, indentEnd);
	}

	/**
	 * Prefixes each non-empty line with {@code baseIndent}. The first line is
	 * skipped when it continues text already indented in the document.
	 */
	static String indentFragment(String formatted, String baseIndent, boolean indentFirstLine) {
		if (baseIndent.isEmpty()) {
			return formatted;
		}
		String[] lines = formatted.split("\n", -1);
		StringBuilder result = new StringBuilder(formatted.length() + lines.length * baseIndent.length());
		for (int i = 0; i < lines.length; i++) {
			if (i > 0) {
				result.append('\n');
			}
			if (!lines[i].isEmpty() && (i > 0 || indentFirstLine)) {
				result.append(baseIndent);
			}
			result.append(lines[i]);
		}
		return result.toString();
	}
}
