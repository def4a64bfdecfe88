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

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LspRequestGuardTests {

	private static final String URI_JSP = "file:///web/index.jsp";

	private final LspRequestGuard guard = new LspRequestGuard();

	@Test
	void testSuccessfulRequestPassesThrough() throws Exception {
		CompletableFuture<String> result = guard.failSoftRequest("formatting", URI_JSP,
				() -> CompletableFuture.completedFuture("ok"), "fallback");
		Assertions.assertEquals("ok", result.get());
	}

	@Test
	void testSynchronousFailureReturnsFallback() throws Exception {
		CompletableFuture<String> result = guard.failSoftRequest("formatting", URI_JSP, () -> {
			throw new IllegalStateException("boom");
		}, "fallback");
		Assertions.assertEquals("fallback", result.get());
	}

	@Test
	void testAsynchronousFailureReturnsFallback() throws Exception {
		CompletableFuture<String> failing = new CompletableFuture<>();
		failing.completeExceptionally(new IllegalArgumentException("bad range"));
		CompletableFuture<String> result = guard.failSoftRequest("rangeFormatting", URI_JSP, () -> failing,
				"fallback");
		Assertions.assertEquals("fallback", result.get());
	}

	@Test
	void testNullFutureReturnsFallback() throws Exception {
		CompletableFuture<String> result = guard.failSoftRequest("formatting", URI_JSP, () -> null, "fallback");
		Assertions.assertEquals("fallback", result.get());
	}

	@Test
	void testCancellationIsNotSwallowed() {
		CompletableFuture<String> cancelled = new CompletableFuture<>();
		cancelled.cancel(true);
		CompletableFuture<String> result = guard.failSoftRequest("formatting", URI_JSP, () -> cancelled, "fallback");
		Assertions.assertTrue(result.isCompletedExceptionally());
		Assertions.assertThrows(Exception.class, result::get);
	}

	@Test
	void testVirtualMachineErrorIsRethrown() {
		Assertions.assertThrows(OutOfMemoryError.class, () -> guard.failSoftRequest("formatting", URI_JSP, () -> {
			throw new OutOfMemoryError("test");
		}, "fallback"));
	}

	@Test
	void testUnwrapRequestThrowable() {
		IllegalStateException root = new IllegalStateException("root");
		Throwable wrapped = new CompletionException(new ExecutionException(root));
		Assertions.assertSame(root, LspRequestGuard.unwrapRequestThrowable(wrapped));
		CompletionException bare = new CompletionException("no cause", null);
		Assertions.assertSame(bare, LspRequestGuard.unwrapRequestThrowable(bare));
	}

	@Test
	void testSummarizeThrowable() {
		Assertions.assertEquals("<null>", LspRequestGuard.summarizeThrowable(null));
		Assertions.assertEquals("java.lang.IllegalStateException", LspRequestGuard.summarizeThrowable(
				new IllegalStateException()));
		Assertions.assertEquals("java.lang.IllegalStateException: x", LspRequestGuard.summarizeThrowable(
				new IllegalStateException("x")));
	}

	@Test
	void testPassThroughThrowables() {
		Assertions.assertTrue(LspRequestGuard.isPassThroughThrowable(new StackOverflowError()));
		Assertions.assertTrue(LspRequestGuard.isPassThroughThrowable(new CancellationException()));
		Assertions.assertFalse(LspRequestGuard.isPassThroughThrowable(new RuntimeException()));
	}
}
