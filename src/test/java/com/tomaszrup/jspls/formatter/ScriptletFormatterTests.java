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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ScriptletFormatterTests {

	private final ScriptletFormatter formatter = new ScriptletFormatter(FormatOptions.defaults());

	// --- One-line blocks ---

	@Test
	void testEmptyBlock() {
		Assertions.assertEquals("<% %>", formatter.formatBlock("<%   \n  %>"));
		Assertions.assertEquals("<%! %>", formatter.formatBlock("<%!%>"));
	}

	@Test
	void testSingleStatementStaysOnOneLine() {
		Assertions.assertEquals("<% int x = 1; %>", formatter.formatBlock("<%int x = 1;%>"));
		Assertions.assertEquals("<%! int count = 0; %>", formatter.formatBlock("<%!   int count = 0;  %>"));
	}

	@Test
	void testIsSingleStatement() {
		Assertions.assertTrue(ScriptletFormatter.isSingleStatement("request.setAttribute(\"a\", 1);"));
		Assertions.assertFalse(ScriptletFormatter.isSingleStatement("a(); b();"));
		Assertions.assertFalse(ScriptletFormatter.isSingleStatement("if (a) {"));
		Assertions.assertFalse(ScriptletFormatter.isSingleStatement("a();\nb()"));
		Assertions.assertFalse(ScriptletFormatter.isSingleStatement("x".repeat(ScriptletFormatter.MAX_SINGLE_LINE_LENGTH)));
	}

	// --- Multi-line blocks ---

	@Test
	void testStatementsAreSplit() {
		Assertions.assertEquals("<%\n    a();\n    b();\n%>", formatter.formatBlock("<% a(); b(); %>"));
	}

	@Test
	void testBracesDriveIndentation() {
		String expected = "<%\n"
				+ "    int x=1;\n"
				+ "    if(x>0){\n"
				+ "        out.println(x);\n"
				+ "    }\n"
				+ "%>";
		Assertions.assertEquals(expected, formatter.formatBlock("<% int x=1; if(x>0){ out.println(x); } %>"));
	}

	@Test
	void testElseStaysOnClosingBraceLine() {
		String expected = "<%\n"
				+ "    if (a) {\n"
				+ "        x();\n"
				+ "    } else {\n"
				+ "        y();\n"
				+ "    }\n"
				+ "%>";
		Assertions.assertEquals(expected, formatter.formatBlock("<% if (a) { x(); } else { y(); } %>"));
	}

	@Test
	void testForHeaderStaysOnOneLine() {
		String expected = "<%\n"
				+ "    for (int i = 0; i < 3; i++) {\n"
				+ "        out.print(i);\n"
				+ "    }\n"
				+ "%>";
		Assertions.assertEquals(expected,
				formatter.formatBlock("<% for (int i = 0; i < 3; i++) { out.print(i); } %>"));
	}

	@Test
	void testStringLiteralsAreNotSplit() {
		String expected = "<%\n"
				+ "    out.println(\"a; {b} \\\"c;\\\"\");\n"
				+ "    x();\n"
				+ "%>";
		Assertions.assertEquals(expected, formatter.formatBlock("<% out.println(\"a; {b} \\\"c;\\\"\"); x(); %>"));
	}

	@Test
	void testUnbalancedClosingBraceKeepsMinimumIndent() {
		Assertions.assertEquals("<%\n    }\n    }\n    a();\n%>", formatter.formatBlock("<%\n}\n}\na();\n%>"));
	}

	@Test
	void testUsesTabsWhenConfigured() {
		ScriptletFormatter tabs = new ScriptletFormatter(FormatOptions.of(4, false));
		Assertions.assertEquals("<%\n\tif (a) {\n\t\tb();\n\t}\n%>", tabs.formatBlock("<% if (a) { b(); } %>"));
	}

	@Test
	void testFormattedBlockIsStable() {
		String once = formatter.formatBlock("<% try { a(); } catch (Exception e) { b(); } finally { c(); } %>");
		Assertions.assertEquals(once, formatter.formatBlock(once));
	}

	// --- Helpers ---

	@Test
	void testBreakBeforeClosingBraces() {
		Assertions.assertEquals("a();\n}", ScriptletFormatter.breakBeforeClosingBraces("a();}"));
		Assertions.assertEquals("}", ScriptletFormatter.breakBeforeClosingBraces("}"));
		Assertions.assertEquals("x\n  }", ScriptletFormatter.breakBeforeClosingBraces("x\n  }"));
	}

	@Test
	void testJoinForHeaders() {
		Assertions.assertEquals("for (int i = 0; i < n; i++) {",
				ScriptletFormatter.joinForHeaders("for (int i = 0;\n i < n;\n i++) {"));
		Assertions.assertEquals("for (x;\n", ScriptletFormatter.joinForHeaders("for (x;\n"));
	}
}
