////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.jspls.util;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;

/**
 * Thread-safe store of the text of JSP documents the client has open.
 *
 * <p>Formatting requests can also arrive for documents that are not open
 * (some clients format on save after closing). Those are read from disk and
 * remembered for {@value #CLOSED_FILE_CACHE_TTL_MS} ms.</p>
 */
public class FileContentsTracker {
	private static final Logger logger = LoggerFactory.getLogger(FileContentsTracker.class);

	static final long CLOSED_FILE_CACHE_TTL_MS = 5_000;

	private final Map<URI, String> openDocuments = new ConcurrentHashMap<>();
	private final Map<URI, DiskSnapshot> recentlyClosed = new ConcurrentHashMap<>();
	private final LongSupplier clock;

	/** Text of a document that is not open, with the time it was captured. */
	private final class DiskSnapshot {
		private final String text;
		private final long capturedAt;

		private DiskSnapshot(String text) {
			this.text = text;
			this.capturedAt = clock.getAsLong();
		}

		private boolean isFresh() {
			return clock.getAsLong() - capturedAt <= CLOSED_FILE_CACHE_TTL_MS;
		}
	}

	public FileContentsTracker() {
		this(System::currentTimeMillis);
	}

	/**
	 * @param clock milliseconds source used to expire disk snapshots
	 */
	FileContentsTracker(LongSupplier clock) {
		this.clock = clock;
	}

	public void didOpen(DidOpenTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		recentlyClosed.remove(uri);
		openDocuments.put(uri, params.getTextDocument().getText());
	}

	public void didChange(DidChangeTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		List<TextDocumentContentChangeEvent> changes = params.getContentChanges();
		openDocuments.compute(uri, (key, text) -> applyChanges(uri, text, changes));
	}

	/**
	 * Applies changes in notification order. A ranged change that does not
	 * fit the current text replaces the whole document.
	 */
	static String applyChanges(URI uri, String text, List<TextDocumentContentChangeEvent> changes) {
		String result = text;
		for (TextDocumentContentChangeEvent change : changes) {
			Range range = change.getRange();
			if (result == null || range == null) {
				result = change.getText();
				continue;
			}
			int start = Positions.getOffset(result, range.getStart());
			int end = Positions.getOffset(result, range.getEnd());
			if (start < 0 || end < start) {
				logger.debug("Change range {} does not fit {}; replacing the whole document", range, uri);
				result = change.getText();
			} else {
				result = new StringBuilder(result).replace(start, end, change.getText()).toString();
			}
		}
		return result;
	}

	public void didClose(DidCloseTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		String last = openDocuments.remove(uri);
		recentlyClosed.values().removeIf(snapshot -> !snapshot.isFresh());
		if (last != null) {
			recentlyClosed.put(uri, new DiskSnapshot(last));
		}
		logger.debug("Closed {}; {} disk snapshot(s) cached", uri, cachedSnapshotCount());
	}

	/**
	 * Text of an open document, or of a closed {@code file:} document.
	 *
	 * @return {@code null} when the document is neither open nor readable
	 */
	public String getContents(URI uri) {
		String open = openDocuments.get(uri);
		if (open != null) {
			return open;
		}
		DiskSnapshot snapshot = recentlyClosed.get(uri);
		if (snapshot != null) {
			if (snapshot.isFresh()) {
				return snapshot.text;
			}
			recentlyClosed.remove(uri, snapshot);
		}
		return readFromDisk(uri);
	}

	private String readFromDisk(URI uri) {
		if (!"file".equals(uri.getScheme())) {
			return null;
		}
		try {
			String text = Files.readString(Path.of(uri));
			recentlyClosed.put(uri, new DiskSnapshot(text));
			return text;
		} catch (IOException e) {
			logger.debug("Could not read {}: {}", uri, e.toString());
			recentlyClosed.remove(uri);
			return null;
		}
	}

	int cachedSnapshotCount() {
		return recentlyClosed.size();
	}

	/** Forgets disk snapshots of files that changed on disk. */
	public void invalidateClosedFileCache(Collection<URI> uris) {
		uris.forEach(recentlyClosed::remove);
	}
}
