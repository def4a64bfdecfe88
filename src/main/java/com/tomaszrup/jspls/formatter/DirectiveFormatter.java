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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays out a {@code <%@ ... %>} directive on one line, or with one
 * attribute per line when it is long and has several attributes:
 *
 * <pre>
 * &lt;%@ page
 *     language="java"
 *     contentType="text/html; charset=UTF-8" %&gt;
 * </pre>
 */
public class DirectiveFormatter {
	private static final Logger logger = LoggerFactory.getLogger(DirectiveFormatter.class);

	static final int MAX_SINGLE_LINE_LENGTH = 120;
	static final String ATTRIBUTE_INDENT = "    ";

	private static final Pattern DIRECTIVE_SHAPE = Pattern.compile("^(<%@\\s*\\w+)\\s+(.*?)\\s*(%>)$",
			Pattern.DOTALL);
	private static final Pattern ATTRIBUTE = Pattern.compile("\\w+(?::\\w+)?=\"[^\"]*\"");

	public String format(String directive) {
		String collapsed = directive.replaceAll("\\s+", " ").trim();
		if (collapsed.length() <= MAX_SINGLE_LINE_LENGTH) {
			return collapsed;
		}

		Matcher shape = DIRECTIVE_SHAPE.matcher(collapsed);
		if (!shape.matches()) {
			logger.debug("Directive does not have the expected shape, keeping single line");
			return collapsed;
		}

		List<String> attributes = parseAttributes(shape.group(2));
		if (attributes == null || attributes.size() <= 1) {
			return collapsed;
		}

		StringBuilder result = new StringBuilder(shape.group(1));
		for (String attribute : attributes) {
			result.append('\n').append(ATTRIBUTE_INDENT).append(attribute);
		}
		result.append(' ').append(shape.group(3));
		return result.toString();
	}

	/**
	 * Scans {@code name="value"} pairs left to right.
	 *
	 * @return the pairs in order, or {@code null} if anything other than
	 *         whitespace sits between them
	 */
	static List<String> parseAttributes(String attributeText) {
		List<String> attributes = new ArrayList<>();
		Matcher matcher = ATTRIBUTE.matcher(attributeText);
		int last = 0;
		while (matcher.find()) {
			if (!attributeText.substring(last, matcher.start()).isBlank()) {
				return null;
			}
			attributes.add(matcher.group());
			last = matcher.end();
		}
		if (!attributeText.substring(last).isBlank()) {
			return null;
		}
		return attributes;
	}
}
