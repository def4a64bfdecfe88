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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats a JSP document (or any contiguous part of one).
 *
 * <p>The text goes through three passes:</p>
 * <ol>
 *   <li>{@link RegionExtractor}: comments, scriptlets, declarations,
 *       expressions, directives, EL fragments and script/style bodies are
 *       swapped for placeholder tokens; scriptlets, declarations, directives,
 *       expressions and short comments are reformatted on the way.</li>
 *   <li>{@link StructuralIndenter}: the remaining tag skeleton is
 *       re-indented line by line.</li>
 *   <li>{@link Reassembler}: tokens are restored, blank-line runs capped and
 *       the document terminated with a single newline.</li>
 * </ol>
 *
 * <p>Formatting never throws for any input string. A fresh
 * {@code JspFormatter} holds no state between calls, so a single instance
 * may be shared between threads.</p>
 */
public class JspFormatter {
	private static final Logger logger = LoggerFactory.getLogger(JspFormatter.class);

	/**
	 * @param options formatting options; {@code null} means
	 *                {@link FormatOptions#defaults()}
	 */
	public String format(String text, FormatOptions options) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		if (options == null) {
			options = FormatOptions.defaults();
		}
		long start = System.nanoTime();
		String normalized = normalizeLineEndings(text);

		RegionExtractor.Extraction extraction = new RegionExtractor(options).extract(normalized);
		String indented = new StructuralIndenter(options).indent(extraction.getText());
		String formatted = new Reassembler(options).reassemble(indented, extraction.getTable());

		if (logger.isTraceEnabled()) {
			logger.trace("Formatted {} chars ({} regions) in {}us with {}", text.length(),
					extraction.getTable().size(), (System.nanoTime() - start) / 1000, options);
		}
		return formatted;
	}

	public static String normalizeLineEndings(String text) {
		return text.replace("\r\n", "\n").replace("\r", "\n");
	}
}
