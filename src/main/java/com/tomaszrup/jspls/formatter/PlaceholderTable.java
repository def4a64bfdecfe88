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

/**
 * Maps placeholder tokens to the text they stand for during one formatting
 * invocation.
 *
 * <p>Tokens look like {@code __JSPFMT_EL_3__}. They contain no whitespace
 * and no angle brackets, so a line holding a token is classified exactly as
 * the surrounding text would be. The marker is salted until it does not
 * occur in the source text, which keeps every token unique against the
 * document being formatted.</p>
 *
 * <p>{@link #restore(String)} expands tokens in reverse allocation order: a
 * region captured inside a later region (an EL fragment inside a
 * {@code <script>} body, say) only reappears once its container has been
 * restored.</p>
 */
public final class PlaceholderTable {

	private static final String BASE_MARKER = "__JSPFMT";

	private final String marker;
	private final List<String> tokens = new ArrayList<>();
	private final List<String> contents = new ArrayList<>();

	/**
	 * @param sourceText the text the tokens will be substituted into; used
	 *                   only to choose a marker that never occurs in it
	 */
	public PlaceholderTable(String sourceText) {
		this.marker = chooseMarker(sourceText);
	}

	private static String chooseMarker(String sourceText) {
		String candidate = BASE_MARKER;
		int salt = 0;
		while (sourceText != null && sourceText.contains(candidate)) {
			salt++;
			candidate = BASE_MARKER + salt;
		}
		return candidate;
	}

	/**
	 * Allocates a fresh token for {@code content} under the given label.
	 *
	 * @return the token to substitute into the text
	 */
	public String allocate(String label, String content) {
		String token = marker + "_" + label + "_" + tokens.size() + "__";
		tokens.add(token);
		contents.add(content);
		return token;
	}

	public int size() {
		return tokens.size();
	}

	/**
	 * Replaces each token in {@code text} with its content, once per token.
	 * A token missing from the text is skipped.
	 */
	public String restore(String text) {
		StringBuilder result = new StringBuilder(text);
		for (int i = tokens.size() - 1; i >= 0; i--) {
			String token = tokens.get(i);
			int index = result.indexOf(token);
			if (index >= 0) {
				result.replace(index, index + token.length(), contents.get(i));
			}
		}
		return result.toString();
	}
}
