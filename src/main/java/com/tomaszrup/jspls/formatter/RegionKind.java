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
 * Lexically delimited spans that the structural indenter must not look
 * into. Declaration order is extraction order: a later kind never matches
 * inside a region an earlier kind already replaced with a token.
 */
public enum RegionKind {
	/** {@code <%-- ... --%>} */
	COMMENT("COMMENT", "<%--[\\s\\S]*?--%>"),
	/** {@code <%! ... %>} */
	DECLARATION("DECL", "<%![\\s\\S]*?%>"),
	/** {@code <%= ... %>} */
	EXPRESSION("EXPR", "<%=[\\s\\S]*?%>"),
	/** {@code <% ... %>} other than the {@code = ! @ -} forms */
	SCRIPTLET("SCRIPT", "<%(?![=!@-])[\\s\\S]*?%>"),
	/** {@code <%@ ... %>} */
	DIRECTIVE("DIR", "<%@[\\s\\S]*?%>"),
	/** {@code <!-- ... -->} */
	MARKUP_COMMENT("HTMLCOMMENT", "<!--[\\s\\S]*?-->"),
	/** {@code ${...}} */
	EL_IMMEDIATE("EL", "\\$\\{[^}]*\\}"),
	/** {@code #{...}} */
	EL_DEFERRED("DEL", "#\\{[^}]*\\}"),
	/** {@code <script ...> ... </script>} */
	SCRIPT_BODY("SCRIPTBODY", "(?i)<script\\b[\\s\\S]*?</script\\s*>"),
	/** {@code <style ...> ... </style>} */
	STYLE_BODY("STYLEBODY", "(?i)<style\\b[\\s\\S]*?</style\\s*>");

	private final String tokenLabel;
	private final Pattern pattern;

	RegionKind(String tokenLabel, String regex) {
		this.tokenLabel = tokenLabel;
		this.pattern = Pattern.compile(regex);
	}

	/** Label embedded in placeholder tokens for regions of this kind. */
	public String getTokenLabel() {
		return tokenLabel;
	}

	public Pattern getPattern() {
		return pattern;
	}
}
