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

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.jsonrpc.CompletableFutures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.jspls.config.FormatSettings;
import com.tomaszrup.jspls.formatter.FormatOptions;
import com.tomaszrup.jspls.providers.FormattingProvider;
import com.tomaszrup.jspls.util.FileContentsTracker;

/**
 * Handles {@code textDocument/formatting} and
 * {@code textDocument/rangeFormatting}. Formatting runs off the message
 * thread and is abandoned when the client cancels the request.
 */
class FormattingHandler {
	private static final Logger logger = LoggerFactory.getLogger(FormattingHandler.class);

	private final FormattingProvider formattingProvider;
	private final FileContentsTracker fileContentsTracker;

	FormattingHandler(FormattingProvider formattingProvider, FileContentsTracker fileContentsTracker) {
		this.formattingProvider = formattingProvider;
		this.fileContentsTracker = fileContentsTracker;
	}

	CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params,
			FormatSettings settings) {
		URI uri = URI.create(params.getTextDocument().getUri());
		String sourceText = fileContentsTracker.getContents(uri);
		if (sourceText == null || sourceText.isEmpty()) {
			logger.debug("Nothing to format for {}", uri);
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		FormatOptions options = settings.toFormatOptions(params.getOptions());
		return CompletableFutures.<List<? extends TextEdit>>computeAsync(cancelChecker -> {
			List<TextEdit> edits = formattingProvider.provideFormatting(sourceText, options);
			cancelChecker.checkCanceled();
			logger.debug("formatting uri={} edits={}", uri, edits.size());
			return edits;
		});
	}

	CompletableFuture<List<? extends TextEdit>> rangeFormatting(DocumentRangeFormattingParams params,
			FormatSettings settings) {
		URI uri = URI.create(params.getTextDocument().getUri());
		String sourceText = fileContentsTracker.getContents(uri);
		if (sourceText == null || sourceText.isEmpty()) {
			logger.debug("Nothing to format for {}", uri);
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		FormatOptions options = settings.toFormatOptions(params.getOptions());
		return CompletableFutures.<List<? extends TextEdit>>computeAsync(cancelChecker -> {
			List<TextEdit> edits = formattingProvider.provideRangeFormatting(sourceText, params.getRange(), options);
			cancelChecker.checkCanceled();
			logger.debug("rangeFormatting uri={} range={} edits={}", uri, params.getRange(), edits.size());
			return edits;
		});
	}
}
