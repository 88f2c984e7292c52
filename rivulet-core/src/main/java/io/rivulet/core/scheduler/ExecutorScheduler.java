/*
 * Copyright (c) 2026 The Rivulet Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.rivulet.core.scheduler;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import io.rivulet.core.Disposable;
import io.rivulet.core.Exceptions;
import io.rivulet.core.TerminalGuard;
import org.jspecify.annotations.Nullable;

/**
 * A {@link Scheduler} handing each task to an {@link Executor}. When it owns an
 * {@link ExecutorService}, disposing the scheduler shuts that service down.
 */
final class ExecutorScheduler implements Scheduler {

	final Executor                  executor;
	final @Nullable ExecutorService owned;
	final TerminalGuard             lifecycle = new TerminalGuard();

	ExecutorScheduler(Executor executor, @Nullable ExecutorService owned) {
		this.executor = executor;
		this.owned = owned;
	}

	@Override
	public Disposable schedule(Runnable task) {
		Objects.requireNonNull(task, "task");
		if (lifecycle.isStopped()) {
			throw Exceptions.failWithRejected("Scheduler is disposed");
		}
		ScheduledTask scheduled = new ScheduledTask(task);
		try {
			executor.execute(scheduled);
		}
		catch (RejectedExecutionException ex) {
			scheduled.dispose();
			throw Exceptions.failWithRejected(ex);
		}
		return scheduled;
	}

	@Override
	public void dispose() {
		if (lifecycle.stop() && owned != null) {
			owned.shutdownNow();
		}
	}

	@Override
	public boolean isDisposed() {
		return lifecycle.isStopped();
	}

	@Override
	public String toString() {
		return "Schedulers." + Schedulers.FROM_EXECUTOR + "(" + executor + ")";
	}

	/**
	 * Runs the task unless it was disposed first. The executor keeps its copy queued
	 * either way.
	 */
	static final class ScheduledTask implements Runnable, Disposable {

		final Runnable      task;
		final TerminalGuard state = new TerminalGuard();

		ScheduledTask(Runnable task) {
			this.task = task;
		}

		@Override
		public void run() {
			if (!state.stop()) {
				return;
			}
			try {
				task.run();
			}
			catch (Throwable ex) {
				Exceptions.throwIfFatal(ex);
				Schedulers.handleError(ex);
			}
		}

		@Override
		public void dispose() {
			state.stop();
		}

		@Override
		public boolean isDisposed() {
			return state.isStopped();
		}
	}
}
