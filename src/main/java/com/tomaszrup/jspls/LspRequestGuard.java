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
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs formatting requests so that a failure is logged and answered with a
 * fallback value instead of an error response. Cancellation and
 * {@link VirtualMachineError}s are not caught.
 */
class LspRequestGuard {
	private static final Logger logger = LoggerFactory.getLogger(LspRequestGuard.class);

	<T> CompletableFuture<T> failSoftRequest(String requestName, String uri,
			Supplier<CompletableFuture<T>> requestCall, T fallbackValue) {
		CompletableFuture<T> future;
		try {
			future = requestCall.get();
		} catch (Exception | LinkageError e) {
			return CompletableFuture.completedFuture(recover(requestName, uri, e, "sync", fallbackValue));
		}
		if (future == null) {
			return CompletableFuture.completedFuture(fallbackValue);
		}
		return future.exceptionally(t -> recover(requestName, uri, t, "async", fallbackValue));
	}

	private <T> T recover(String requestName, String uri, Throwable throwable, String phase, T fallbackValue) {
		Throwable cause = unwrapRequestThrowable(throwable);
		if (isPassThroughThrowable(cause)) {
			throwAsUnchecked(cause);
		}
		logger.warn("{} request failed ({}), uri={}, error={}", requestName, phase, uri, summarizeThrowable(cause));
		logger.debug("{} request failure details", requestName, cause);
		return fallbackValue;
	}

	static String summarizeThrowable(Throwable throwable) {
		if (throwable == null) {
			return "<null>";
		}
		String name = throwable.getClass().getName();
		String message = throwable.getMessage();
		return message == null || message.isBlank() ? name : name + ": " + message;
	}

	/** Strips {@link CompletionException} and {@link ExecutionException} wrappers. */
	static Throwable unwrapRequestThrowable(Throwable throwable) {
		Throwable current = throwable;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	static boolean isPassThroughThrowable(Throwable throwable) {
		return throwable instanceof VirtualMachineError || throwable instanceof CancellationException;
	}

	private static void throwAsUnchecked(Throwable throwable) {
		if (throwable instanceof RuntimeException) {
			throw (RuntimeException) throwable;
		}
		if (throwable instanceof Error) {
			throw (Error) throwable;
		}
		throw new IllegalStateException("Unexpected checked throwable", throwable);
	}
}
