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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reformats the Java payload of {@code <% ... %>} and {@code <%! ... %>}
 * blocks with a statement/brace heuristic.
 *
 * <p>This is not a Java parser. Braces inside char literals or comments,
 * lambda bodies, anonymous classes ({@code };}) and nested block comments
 * are laid out as if they were plain statements and braces.</p>
 */
public class ScriptletFormatter {

	static final int MAX_SINGLE_LINE_LENGTH = 60;

	private static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+\"");
	private static final Pattern UNBROKEN_SEMICOLON = Pattern.compile(";(?!\\s*\\n)");
	private static final Pattern UNBROKEN_OPEN_BRACE = Pattern.compile("\\{(?!\\s*\\n)");
	private static final Pattern UNBROKEN_CLOSE_BRACE = Pattern.compile("\\}(?!\\s*(?:else|catch|finally|\\n))");
	private static final Pattern FOR_HEADER_START = Pattern.compile("\\bfor\\s*\\(");
	private static final Pattern BROKEN_SEMICOLON = Pattern.compile(";\\s*\\n\\s*");

	private final String indent;

	public ScriptletFormatter(FormatOptions options) {
		this.indent = options.indentUnit();
	}

	/**
	 * Formats a whole block including its delimiters.
	 */
	public String formatBlock(String block) {
		String prefix = block.startsWith("<%!") ? "<%!" : "<%";
		String content = block.substring(prefix.length(), block.length() - 2).trim();
		if (content.isEmpty()) {
			return prefix + " %>";
		}
		if (isSingleStatement(content)) {
			return prefix + " " + content + " %>";
		}
		return prefix + "\n" + formatCode(content) + "\n%>";
	}

	static boolean isSingleStatement(String content) {
		return content.indexOf('\n') < 0
				&& content.length() < MAX_SINGLE_LINE_LENGTH
				&& content.indexOf('{') < 0
				&& countChar(content, ';') <= 1;
	}

	/**
	 * Re-breaks and re-indents block content. Every non-blank line is
	 * indented at least one level.
	 */
	String formatCode(String code) {
		PlaceholderTable strings = new PlaceholderTable(code);
		String text = protectStrings(code, strings);
		text = text.replace("\r\n", "\n").replace("\r", "\n");
		text = UNBROKEN_SEMICOLON.matcher(text).replaceAll(";\n");
		text = UNBROKEN_OPEN_BRACE.matcher(text).replaceAll("{\n");
		text = breakBeforeClosingBraces(text);
		text = UNBROKEN_CLOSE_BRACE.matcher(text).replaceAll("}\n");
		text = joinForHeaders(text);
		return strings.restore(indentByBraces(text));
	}

	private static String protectStrings(String code, PlaceholderTable strings) {
		Matcher matcher = STRING_LITERAL.matcher(code);
		StringBuilder result = new StringBuilder(code.length());
		int last = 0;
		while (matcher.find()) {
			result.append(code, last, matcher.start());
			result.append(strings.allocate("STR", matcher.group()));
			last = matcher.end();
		}
		result.append(code, last, code.length());
		return result.toString();
	}

	/**
	 * Inserts a line break before each {@code '}'} that is not already the
	 * first non-blank character of its line.
	 */
	static String breakBeforeClosingBraces(String text) {
		StringBuilder result = new StringBuilder(text.length() + 16);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '}' && !startsLine(result)) {
				result.append('\n');
			}
			result.append(c);
		}
		return result.toString();
	}

	private static boolean startsLine(CharSequence text) {
		for (int i = text.length() - 1; i >= 0; i--) {
			char c = text.charAt(i);
			if (c == '\n') {
				return true;
			}
			if (!Character.isWhitespace(c)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Puts the clauses of each {@code for (...)} header back on one line.
	 * The header runs to the matching parenthesis.
	 */
	static String joinForHeaders(String text) {
		Matcher matcher = FOR_HEADER_START.matcher(text);
		StringBuilder result = new StringBuilder(text.length());
		int last = 0;
		while (matcher.find(last)) {
			int open = matcher.end() - 1;
			int close = findMatchingParen(text, open);
			if (close < 0) {
				break;
			}
			String header = text.substring(open, close + 1);
			header = BROKEN_SEMICOLON.matcher(header).replaceAll("; ").replace("; )", ";)");
			result.append(text, last, open).append(header);
			last = close + 1;
		}
		result.append(text, last, text.length());
		return result.toString();
	}

	private static int findMatchingParen(String text, int open) {
		int depth = 0;
		for (int i = open; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}

	private String indentByBraces(String text) {
		List<String> lines = new ArrayList<>();
		int level = 1;
		for (String rawLine : text.split("\n", -1)) {
			String trimmed = rawLine.trim();
			if (trimmed.isEmpty()) {
				lines.add("");
				continue;
			}
			if (trimmed.startsWith("}")) {
				level = Math.max(1, level - 1);
			}
			lines.add(indent.repeat(level) + trimmed);
			if (trimmed.endsWith("{")) {
				level++;
			}
		}
		int from = 0;
		int to = lines.size();
		while (from < to && lines.get(from).isEmpty()) {
			from++;
		}
		while (to > from && lines.get(to - 1).isEmpty()) {
			to--;
		}
		return String.join("\n", lines.subList(from, to));
	}

	private static int countChar(String text, char c) {
		int count = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == c) {
				count++;
			}
		}
		return count;
	}
}
