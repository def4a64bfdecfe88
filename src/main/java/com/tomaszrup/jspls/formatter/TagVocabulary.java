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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tag name tables that drive indentation. Names are matched exactly; markup
 * names case-insensitively, prefixed custom tags case-sensitively.
 *
 * <p>Bump {@link #VERSION} whenever a table changes.</p>
 */
public final class TagVocabulary {

	public static final int VERSION = 1;

	/** Markup elements that never have a body. */
	public static final Set<String> VOID_ELEMENTS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
			"br", "hr", "img", "input", "link", "meta", "area", "base", "col", "embed",
			"param", "source", "track", "wbr")));

	/** Custom tags that are written without a body. */
	public static final Set<String> VOID_CUSTOM_TAGS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
			"jsp:include", "jsp:forward", "jsp:param", "jsp:setProperty", "jsp:getProperty", "jsp:useBean",
			"c:out", "c:set", "c:remove", "c:param", "c:redirect",
			"fmt:message", "fmt:formatNumber", "fmt:formatDate", "fmt:setLocale", "fmt:setBundle",
			"fmt:requestEncoding", "fmt:setTimeZone",
			"sql:param", "sql:dateParam", "sql:setDataSource")));

	/** Custom tags whose open and close forms nest, keyed by namespace prefix. */
	public static final Map<String, Set<String>> BLOCK_TAGS_BY_PREFIX;

	static {
		Map<String, Set<String>> blockTags = new LinkedHashMap<>();
		blockTags.put("c", names("if", "choose", "when", "otherwise", "forEach", "forTokens", "catch",
				"import", "url"));
		blockTags.put("fmt", names("bundle", "timeZone"));
		blockTags.put("sql", names("query", "update", "transaction"));
		blockTags.put("x", names("parse", "if", "choose", "when", "otherwise", "forEach", "transform"));
		blockTags.put("jsp", names("include", "forward", "useBean", "element", "body", "attribute"));
		BLOCK_TAGS_BY_PREFIX = Collections.unmodifiableMap(blockTags);
	}

	private TagVocabulary() {
		// utility class
	}

	private static Set<String> names(String... names) {
		return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(names)));
	}

	/**
	 * Whether {@code name} is a recognized block-scoped custom tag such as
	 * {@code c:forEach}.
	 */
	public static boolean isBlockTag(String name) {
		int colon = name.indexOf(':');
		if (colon <= 0) {
			return false;
		}
		Set<String> localNames = BLOCK_TAGS_BY_PREFIX.get(name.substring(0, colon));
		return localNames != null && localNames.contains(name.substring(colon + 1));
	}

	/**
	 * Whether an opening {@code <name ...>} never starts a nested scope.
	 * Names that are both void and block-scoped ({@code jsp:include}) are
	 * treated as block-scoped here; their self-closed form is handled by the
	 * caller.
	 */
	public static boolean isVoid(String name) {
		if (name.indexOf(':') >= 0) {
			return VOID_CUSTOM_TAGS.contains(name) && !isBlockTag(name);
		}
		return VOID_ELEMENTS.contains(name.toLowerCase(Locale.ROOT));
	}
}
