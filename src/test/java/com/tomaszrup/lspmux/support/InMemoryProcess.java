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
package com.tomaszrup.lspmux.support;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A {@link Process} whose stdio are in-memory pipes. The "child" side is
 * reached through {@link #serverInput()} and {@link #serverOutput()}.
 */
public class InMemoryProcess extends Process {

	private final InMemoryPipe stdin = new InMemoryPipe();
	private final InMemoryPipe stdout = new InMemoryPipe();
	private final InMemoryPipe stderr = new InMemoryPipe();
	private final CompletableFuture<Process> exited = new CompletableFuture<>();
	private volatile int exitCode = -1;
	private volatile boolean ignoreTerminate;
	private volatile int destroyCalls;
	private volatile int destroyForciblyCalls;

	/** What the child reads. */
	public InputStream serverInput() {
		return stdin.getInputStream();
	}

	/** What the child writes as protocol output. */
	public OutputStream serverOutput() {
		return stdout.getOutputStream();
	}

	public OutputStream serverError() {
		return stderr.getOutputStream();
	}

	/** Make {@link #destroy()} a no-op, like a child that traps SIGTERM. */
	public void setIgnoreTerminate(boolean ignoreTerminate) {
		this.ignoreTerminate = ignoreTerminate;
	}

	public int getDestroyCalls() {
		return destroyCalls;
	}

	public int getDestroyForciblyCalls() {
		return destroyForciblyCalls;
	}

	public void exit(int code) {
		synchronized (this) {
			if (exited.isDone()) {
				return;
			}
			exitCode = code;
		}
		stdin.close();
		stdout.close();
		stderr.close();
		exited.complete(this);
	}

	/** Die abruptly. */
	public void crash() {
		exit(137);
	}

	@Override
	public OutputStream getOutputStream() {
		return stdin.getOutputStream();
	}

	@Override
	public InputStream getInputStream() {
		return stdout.getInputStream();
	}

	@Override
	public InputStream getErrorStream() {
		return stderr.getInputStream();
	}

	@Override
	public int waitFor() throws InterruptedException {
		try {
			exited.get();
		} catch (java.util.concurrent.ExecutionException e) {
			throw new IllegalStateException(e);
		}
		return exitCode;
	}

	@Override
	public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
		try {
			exited.get(timeout, unit);
			return true;
		} catch (TimeoutException e) {
			return false;
		} catch (java.util.concurrent.ExecutionException e) {
			throw new IllegalStateException(e);
		}
	}

	@Override
	public int exitValue() {
		if (!exited.isDone()) {
			throw new IllegalThreadStateException("process has not exited");
		}
		return exitCode;
	}

	@Override
	public void destroy() {
		destroyCalls++;
		if (!ignoreTerminate) {
			exit(143);
		}
	}

	@Override
	public Process destroyForcibly() {
		destroyForciblyCalls++;
		exit(137);
		return this;
	}

	@Override
	public boolean isAlive() {
		return !exited.isDone();
	}

	@Override
	public CompletableFuture<Process> onExit() {
		return exited.thenApply(p -> p);
	}

	@Override
	public long pid() {
		return -1;
	}
}
