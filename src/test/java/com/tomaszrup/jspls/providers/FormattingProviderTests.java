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
package com.tomaszrup.jspls.providers;

import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.jspls.formatter.FormatOptions;

class FormattingProviderTests {

	private final FormattingProvider provider = new FormattingProvider();
	private final FormatOptions options = FormatOptions.defaults();

	@Test
	void testDocumentEditSpansNormalizedSource() {
		List<TextEdit> edits = provider.provideFormatting("<div>\r\n<p>x</p>\r\n</div>", options);
		Assertions.assertEquals(1, edits.size());
		Assertions.assertEquals(new Range(new Position(0, 0), new Position(2, 6)), edits.get(0).getRange());
		Assertions.assertEquals("<div>\n    <p>x</p>\n</div>\n", edits.get(0).getNewText());
	}

	@Test
	void testNullOrEmptyDocument() {
		Assertions.assertTrue(provider.provideFormatting(null, options).isEmpty());
		Assertions.assertTrue(provider.provideFormatting("", options).isEmpty());
	}

	@Test
	void testRangeKeepsFirstLineIndentation() {
		String source = "<body>\n  <ul>\n  <li>a</li>\n  </ul>\n</body>\n";
		List<TextEdit> edits = provider.provideRangeFormatting(source,
				new Range(new Position(1, 0), new Position(4, 0)), options);
		Assertions.assertEquals("  <ul>\n      <li>a</li>\n  </ul>\n", edits.get(0).getNewText());
	}

	@Test
	void testRangeStartingAfterIndentation() {
		String source = "<body>\n  <ul>\n  <li>a</li>\n  </ul>\n</body>\n";
		List<TextEdit> edits = provider.provideRangeFormatting(source,
				new Range(new Position(1, 2), new Position(3, 7)), options);
		Assertions.assertEquals("<ul>\n      <li>a</li>\n  </ul>", edits.get(0).getNewText());
	}

	@Test
	void testFormattedCrLfRangeProducesNoEdits() {
		String source = "<div>\r\n    <p>x</p>\r\n</div>\r\n";
		Range whole = new Range(new Position(0, 0), new Position(3, 0));
		Assertions.assertTrue(provider.provideFormatting(source, options).isEmpty());
		Assertions.assertTrue(provider.provideRangeFormatting(source, whole, options).isEmpty());
	}

	@Test
	void testCrLfRangeIsFormattedWithLineFeeds() {
		String source = "<div>\r\n<p>x</p>\r\n</div>\r\n";
		List<TextEdit> edits = provider.provideRangeFormatting(source,
				new Range(new Position(0, 0), new Position(3, 0)), options);
		Assertions.assertEquals("<div>\n    <p>x</p>\n</div>\n", edits.get(0).getNewText());
	}

	@Test
	void testBlankRangeProducesNoEdits() {
		Assertions.assertTrue(provider.provideRangeFormatting("<p>\n\n\n</p>",
				new Range(new Position(1, 0), new Position(2, 0)), options).isEmpty());
	}

	@Test
	void testNullRangeProducesNoEdits() {
		Assertions.assertTrue(provider.provideRangeFormatting("<p/>", null, options).isEmpty());
	}

	@Test
	void testLeadingIndentation() {
		Assertions.assertEquals("\t  ", FormattingProvider.leadingIndentation("x\n\t  <p>", 2));
		Assertions.assertEquals("", FormattingProvider.leadingIndentation("<p>", 0));
	}

	@Test
	void testIndentFragment() {
		Assertions.assertEquals("  a\n\n  b\n", FormattingProvider.indentFragment("a\n\nb\n", "  ", true));
		Assertions.assertEquals("a\n  b", FormattingProvider.indentFragment("a\nb", "  ", false));
		Assertions.assertEquals("a\nb", FormattingProvider.indentFragment("a\nb", "", true));
	}
}
