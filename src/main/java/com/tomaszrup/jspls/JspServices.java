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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.jspls.config.FormatSettings;
import com.tomaszrup.jspls.providers.FormattingProvider;
import com.tomaszrup.jspls.util.FileContentsTracker;

/**
 * Thin facade implementing the LSP {@link TextDocumentService},
 * {@link WorkspaceService}, and {@link LanguageClientAware} interfaces.
 * Delegates to:
 * <ul>
 *   <li>{@link FileContentsTracker}: open document text</li>
 *   <li>{@link FormattingHandler}: document and range formatting</li>
 *   <li>{@link ConfigurationChangeHandler}: {@code jsp.format} settings</li>
 * </ul>
 */
public class JspServices implements TextDocumentService, WorkspaceService, LanguageClientAware {
	private static final Logger logger = LoggerFactory.getLogger(JspServices.class);

	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();
	private final AtomicReference<FormatSettings> formatSettings = new AtomicReference<>(FormatSettings.defaults());
	private final FileContentsTracker fileContentsTracker;
	private final FormattingHandler formattingHandler;
	private final ConfigurationChangeHandler configChangeHandler;
	private final LspRequestGuard requestGuard = new LspRequestGuard();

	public JspServices() {
		this(new FileContentsTracker(), new FormattingProvider());
	}

	JspServices(FileContentsTracker fileContentsTracker, FormattingProvider formattingProvider) {
		this.fileContentsTracker = fileContentsTracker;
		this.formattingHandler = new FormattingHandler(formattingProvider, fileContentsTracker);
		this.configChangeHandler = new ConfigurationChangeHandler(this::applyConfigurationChange);
	}

	@Override
	public void connect(LanguageClient client) {
		this.languageClient.set(client);
	}

	FormatSettings getFormatSettings() {
		return formatSettings.get();
	}

	void setFormatSettings(FormatSettings settings) {
		formatSettings.set(settings != null ? settings : FormatSettings.defaults());
	}

	private void applyConfigurationChange(FormatSettings settings) {
		setFormatSettings(settings);
		LanguageClient client = languageClient.get();
		if (client != null) {
			String state = settings.isEnabled() ? "enabled" : "disabled";
			client.logMessage(new MessageParams(MessageType.Info, "JSP formatting " + state + ": " + settings));
		}
	}

	private <T> CompletableFuture<T> failSoftRequest(String requestName, String uri,
			Supplier<CompletableFuture<T>> requestCall, T fallbackValue) {
		return requestGuard.failSoftRequest(requestName, uri, requestCall, fallbackValue);
	}

	// --- TextDocumentService notifications ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		try {
			fileContentsTracker.didOpen(params);
		} catch (Exception e) {
			logger.warn("Unexpected exception during didOpen for {}: {}", params.getTextDocument().getUri(),
					e.getMessage());
			logger.debug("didOpen exception details", e);
		}
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		try {
			fileContentsTracker.didChange(params);
		} catch (Exception e) {
			logger.warn("Unexpected exception during didChange for {}: {}", params.getTextDocument().getUri(),
					e.getMessage());
			logger.debug("didChange exception details", e);
		}
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		try {
			fileContentsTracker.didClose(params);
		} catch (Exception e) {
			logger.warn("Unexpected exception during didClose for {}: {}", params.getTextDocument().getUri(),
					e.getMessage());
			logger.debug("didClose exception details", e);
		}
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		// the tracker already holds the saved text
	}

	// --- WorkspaceService notifications ---

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		List<URI> uris = new ArrayList<>();
		for (FileEvent event : params.getChanges()) {
			try {
				uris.add(URI.create(event.getUri()));
			} catch (IllegalArgumentException e) {
				logger.debug("Ignoring watched file event with invalid uri {}: {}", event.getUri(), e.getMessage());
			}
		}
		fileContentsTracker.invalidateClosedFileCache(uris);
	}

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		configChangeHandler.handleConfigurationChange(params.getSettings());
	}

	// --- TextDocumentService requests ---

	@Override
	public CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		FormatSettings settings = formatSettings.get();
		if (!settings.isEnabled()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		return failSoftRequest("formatting", params.getTextDocument().getUri(),
				() -> formattingHandler.formatting(params, settings),
				Collections.emptyList());
	}

	@Override
	public CompletableFuture<List<? extends TextEdit>> rangeFormatting(DocumentRangeFormattingParams params) {
		FormatSettings settings = formatSettings.get();
		if (!settings.isEnabled()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		return failSoftRequest("rangeFormatting", params.getTextDocument().getUri(),
				() -> formattingHandler.rangeFormatting(params, settings),
				Collections.emptyList());
	}
}
