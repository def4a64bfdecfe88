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

import com.tomaszrup.jspls.formatter.TagClassifier.LineKind;

/**
 * Re-indents the placeholder-substituted skeleton one line at a time from a
 * running nesting depth.
 *
 * <p>Closing-tag lines lower the depth before they are emitted, opening-tag
 * lines raise it after. The depth never drops below zero, so unmatched
 * closing tags only lose their indentation.</p>
 */
public class StructuralIndenter {

	private final String indentUnit;

	public StructuralIndenter(FormatOptions options) {
		this.indentUnit = options.indentUnit();
	}

	public String indent(String skeleton) {
		String[] lines = skeleton.split("\n", -1);
		StringBuilder result = new StringBuilder(skeleton.length() + 64);
		int depth = 0;
		for (int i = 0; i < lines.length; i++) {
			if (i > 0) {
				result.append('\n');
			}
			String trimmed = lines[i].trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			LineKind kind = TagClassifier.classify(trimmed);
			if (kind == LineKind.CLOSING_TAG) {
				depth = Math.max(0, depth - 1);
			}
			result.append(indentUnit.repeat(depth)).append(trimmed);
			if (kind == LineKind.OPENING_TAG) {
				depth++;
			}
		}
		return result.toString();
	}
}
