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

import io.rivulet.core.Exceptions;
import io.rivulet.util.Logger;
import io.rivulet.util.Loggers;

/**
 * {@link Schedulers} provides the few {@link Scheduler} flavors producers and tests need:
 * <ul>
 *     <li>{@link #immediate()}: runs the task on the caller thread.</li>
 *     <li>{@link #fromExecutor(Executor)}: hands tasks over to an {@link Executor}.</li>
 *     <li>{@link #fromExecutorService(ExecutorService)}: same, disposing the scheduler
 *     shutting the {@link ExecutorService} down.</li>
 * </ul>
 */
public abstract class Schedulers {

	static final String IMMEDIATE     = "immediate";
	static final String FROM_EXECUTOR = "fromExecutor";

	/**
	 * Executes tasks immediately instead of scheduling them.
	 * <p>
	 * As a consequence tasks run on the thread that submitted them. The returned
	 * {@link Scheduler} cannot be disposed.
	 *
	 * @return a reusable {@link Scheduler} that executes tasks immediately
	 */
	public static Scheduler immediate() {
		return ImmediateScheduler.instance();
	}

	/**
	 * Create a {@link Scheduler} which uses a backing {@link Executor} to schedule
	 * Runnables. Disposing it only stops accepting new tasks, the executor is left
	 * running.
	 *
	 * @param executor an {@link Executor}
	 * @return a new {@link Scheduler}
	 */
	public static Scheduler fromExecutor(Executor executor) {
		Objects.requireNonNull(executor, "executor");
		return new ExecutorScheduler(executor, null);
	}

	/**
	 * Create a {@link Scheduler} which uses a backing {@link ExecutorService} to schedule
	 * Runnables. Disposing the scheduler shuts the {@link ExecutorService} down.
	 *
	 * @param executorService an {@link ExecutorService}
	 * @return a new {@link Scheduler}
	 */
	public static Scheduler fromExecutorService(ExecutorService executorService) {
		Objects.requireNonNull(executorService, "executorService");
		return new ExecutorScheduler(executorService, executorService);
	}

	/**
	 * Report a task failure to the {@link Thread.UncaughtExceptionHandler} of the
	 * current thread, or log it if there is none.
	 *
	 * @param ex the task failure
	 */
	static void handleError(Throwable ex) {
		Thread thread = Thread.currentThread();
		Throwable t = Exceptions.unwrap(ex);
		Thread.UncaughtExceptionHandler x = thread.getUncaughtExceptionHandler();
		if (x != null) {
			x.uncaughtException(thread, t);
		}
		else {
			log.error("Scheduler worker failed with an uncaught exception", t);
		}
	}

	Schedulers() {
	}

	static final Logger log = Loggers.getLogger(Schedulers.class);
}
