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
package com.tomaszrup.jspls;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.MessageParams;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tomaszrup.jspls.config.FormatSettings;

/**
 * Tests for {@link JspServices#didChangeConfiguration(DidChangeConfigurationParams)}.
 */
class JspServicesDidChangeConfigurationTests {

	private JspServices services;
	private List<MessageParams> logMessages;

	@BeforeEach
	void setup() {
		logMessages = new ArrayList<>();
		services = new JspServices();
		services.connect(new TestLanguageClient(logMessages::add));
	}

	@AfterEach
	void tearDown() {
		services = null;
	}

	private void changeConfiguration(String json) {
		JsonObject settings = JsonParser.parseString(json).getAsJsonObject();
		services.didChangeConfiguration(new DidChangeConfigurationParams(settings));
	}

	@Test
	void testNonJsonSettingsAreIgnored() {
		services.didChangeConfiguration(new DidChangeConfigurationParams("not-json"));
		Assertions.assertSame(FormatSettings.defaults(), services.getFormatSettings());
	}

	@Test
	void testSettingsWithoutJspSectionAreIgnored() {
		changeConfiguration("{\"jsp\":{\"format\":{\"tabSize\":2}}}");
		changeConfiguration("{\"editor\":{\"tabSize\":8}}");
		Assertions.assertEquals(Integer.valueOf(2), services.getFormatSettings().getTabSize());
	}

	@Test
	void testClientIsToldAboutAppliedSettings() {
		changeConfiguration("{\"jsp\":{\"format\":{\"enable\":false}}}");
		Assertions.assertEquals(1, logMessages.size());
		Assertions.assertTrue(logMessages.get(0).getMessage().startsWith("JSP formatting disabled"));
	}

	@Test
	void testIgnoredSettingsAreNotReported() {
		changeConfiguration("{\"editor\":{\"tabSize\":8}}");
		Assertions.assertTrue(logMessages.isEmpty());
	}

	@Test
	void testFormatSectionIsApplied() {
		changeConfiguration("{\"jsp\":{\"format\":{\"enable\":false,\"tabSize\":3,\"insertSpaces\":false,"
				+ "\"preserveNewlines\":false,\"maxPreserveNewlines\":5,\"wrapLineLength\":80}}}");
		FormatSettings settings = services.getFormatSettings();
		Assertions.assertFalse(settings.isEnabled());
		Assertions.assertEquals(Integer.valueOf(3), settings.getTabSize());
		Assertions.assertEquals(Boolean.FALSE, settings.getInsertSpaces());
		Assertions.assertFalse(settings.isPreserveNewlines());
		Assertions.assertEquals(5, settings.getMaxPreserveNewlines());
		Assertions.assertEquals(80, settings.getWrapLineLength());
	}

	@Test
	void testEmptyJspSectionRestoresDefaults() {
		changeConfiguration("{\"jsp\":{\"format\":{\"enable\":false}}}");
		changeConfiguration("{\"jsp\":{}}");
		Assertions.assertTrue(services.getFormatSettings().isEnabled());
	}
}
