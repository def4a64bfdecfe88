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

class StructuralIndenterTests {

	private final StructuralIndenter indenter = new StructuralIndenter(FormatOptions.of(2, true));

	@Test
	void testOpeningRaisesDepthAfterLine() {
		Assertions.assertEquals("<div>\n  text\n</div>", indenter.indent("<div>\ntext\n</div>"));
	}

	@Test
	void testTokenLinesAreIndentedLikeText() {
		Assertions.assertEquals("<td>\n  __JSPFMT_EXPR_0__\n</td>", indenter.indent("  <td>\n__JSPFMT_EXPR_0__\n    </td>"));
	}

	@Test
	void testBlankLinesAreEmitted() {
		Assertions.assertEquals("<div>\n\n  a\n\n</div>", indenter.indent("<div>\n  \n  a\n\t\n</div>"));
	}

	@Test
	void testDepthIsClampedAtZero() {
		Assertions.assertEquals("</p>\n</p>\n<p>\n  x", indenter.indent("</p>\n  </p>\n<p>\nx"));
	}

	@Test
	void testSelfClosingAndVoidLinesDoNotNest() {
		Assertions.assertEquals("<br>\n<img src=\"a\">\n<x/>\nt", indenter.indent("<br>\n<img src=\"a\">\n<x/>\nt"));
	}

	@Test
	void testTrailingNewlineIsKept() {
		Assertions.assertEquals("<p>\n</p>\n", indenter.indent("<p>\n</p>\n"));
	}
}
