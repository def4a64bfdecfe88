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

import java.util.EnumMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces every protected region with a placeholder token and records the
 * region's content, transformed per {@link RegionKind}, in a
 * {@link PlaceholderTable}.
 *
 * <p>Regions whose closing delimiter is missing never match and stay in the
 * text as-is.</p>
 */
public class RegionExtractor {
	private static final Logger logger = LoggerFactory.getLogger(RegionExtractor.class);

	static final int SHORT_COMMENT_LENGTH = 80;

	/** Result of one extraction pass. */
	public static final class Extraction {
		private final String text;
		private final PlaceholderTable table;

		Extraction(String text, PlaceholderTable table) {
			this.text = text;
			this.table = table;
		}

		/** The input with each region replaced by its token. */
		public String getText() {
			return text;
		}

		public PlaceholderTable getTable() {
			return table;
		}
	}

	private final Map<RegionKind, UnaryOperator<String>> transforms = new EnumMap<>(RegionKind.class);

	public RegionExtractor(FormatOptions options) {
		ScriptletFormatter scriptletFormatter = new ScriptletFormatter(options);
		DirectiveFormatter directiveFormatter = new DirectiveFormatter();
		transforms.put(RegionKind.COMMENT, RegionExtractor::normalizeComment);
		transforms.put(RegionKind.DECLARATION, scriptletFormatter::formatBlock);
		transforms.put(RegionKind.EXPRESSION, RegionExtractor::collapseWhitespace);
		transforms.put(RegionKind.SCRIPTLET, scriptletFormatter::formatBlock);
		transforms.put(RegionKind.DIRECTIVE, directiveFormatter::format);
		transforms.put(RegionKind.MARKUP_COMMENT, UnaryOperator.identity());
		transforms.put(RegionKind.EL_IMMEDIATE, UnaryOperator.identity());
		transforms.put(RegionKind.EL_DEFERRED, UnaryOperator.identity());
		transforms.put(RegionKind.SCRIPT_BODY, UnaryOperator.identity());
		transforms.put(RegionKind.STYLE_BODY, UnaryOperator.identity());
	}

	public Extraction extract(String text) {
		PlaceholderTable table = new PlaceholderTable(text);
		String substituted = text;
		for (RegionKind kind : RegionKind.values()) {
			substituted = extractKind(substituted, kind, table);
		}
		logger.debug("Extracted {} protected region(s)", table.size());
		return new Extraction(substituted, table);
	}

	/**
	 * Replaces every region of a single kind. Visible for testing kinds in
	 * isolation.
	 */
	String extractKind(String text, RegionKind kind, PlaceholderTable table) {
		Matcher matcher = kind.getPattern().matcher(text);
		if (!matcher.find()) {
			return text;
		}
		UnaryOperator<String> transform = transforms.get(kind);
		StringBuilder result = new StringBuilder(text.length());
		int last = 0;
		do {
			result.append(text, last, matcher.start());
			String content = transform.apply(matcher.group());
			result.append(table.allocate(kind.getTokenLabel(), content));
			last = matcher.end();
		} while (matcher.find());
		result.append(text, last, text.length());
		return result.toString();
	}

	/**
	 * Short single-line comments are padded to {@code <%-- text --%>};
	 * anything else is kept verbatim.
	 */
	static String normalizeComment(String comment) {
		String inner = comment.substring(4, comment.length() - 4).trim();
		if (inner.indexOf('\n') < 0 && inner.length() < SHORT_COMMENT_LENGTH) {
			return inner.isEmpty() ? "<%-- --%>" : "<%-- " + inner + " --%>";
		}
		return comment;
	}

	static String collapseWhitespace(String region) {
		return region.replaceAll("\\s+", " ").trim();
	}
}
