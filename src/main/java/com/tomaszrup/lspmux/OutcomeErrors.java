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
package com.tomaszrup.lspmux;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Converts throwables coming out of futures into {@link LspError}s.
 * {@link VirtualMachineError}s are never converted.
 */
final class OutcomeErrors {

	private OutcomeErrors() {
	}

	static LspError toError(String serverId, Throwable throwable) {
		Throwable root = unwrap(throwable);
		if (isFatal(root)) {
			throwAsUnchecked(root);
		}
		if (root instanceof LspException) {
			LspException lspException = (LspException) root;
			return new LspError(serverId, lspException.getReportedCode(), lspException.getMessage());
		}
		if (root instanceof java.util.concurrent.CancellationException) {
			return new LspError(serverId, LspErrorCode.EABORTED.name(), "Request aborted");
		}
		return new LspError(serverId, LspErrorCode.EINTERNAL.name(), summarize(root));
	}

	static LspErrorCode codeOf(Throwable throwable) {
		Throwable root = unwrap(throwable);
		if (root instanceof LspException) {
			return ((LspException) root).getCode();
		}
		if (root instanceof java.util.concurrent.CancellationException) {
			return LspErrorCode.EABORTED;
		}
		return LspErrorCode.EINTERNAL;
	}

	static String summarize(Throwable throwable) {
		if (throwable == null) {
			return "<null>";
		}
		String message = throwable.getMessage();
		if (message == null || message.isBlank()) {
			return throwable.getClass().getName();
		}
		return message;
	}

	static Throwable unwrap(Throwable throwable) {
		Throwable current = throwable;
		while (current instanceof CompletionException
				|| current instanceof ExecutionException) {
			Throwable cause = current.getCause();
			if (cause == null) {
				break;
			}
			current = cause;
		}
		return current;
	}

	static boolean isFatal(Throwable throwable) {
		return throwable instanceof VirtualMachineError;
	}

	static void throwAsUnchecked(Throwable throwable) {
		if (throwable instanceof RuntimeException) {
			throw (RuntimeException) throwable;
		}
		if (throwable instanceof Error) {
			throw (Error) throwable;
		}
		throw new IllegalStateException("Unexpected checked throwable", throwable);
	}
}
