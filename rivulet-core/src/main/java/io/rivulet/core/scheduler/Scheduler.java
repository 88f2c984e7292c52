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

import java.util.concurrent.RejectedExecutionException;

import io.rivulet.core.Disposable;

/**
 * Provides an abstract asynchronous boundary to producers that want to emit from
 * another execution context. The core never schedules anything by itself.
 */
public interface Scheduler extends Disposable {

	/**
	 * Schedules the non-delayed execution of the given task on this scheduler.
	 *
	 * @param task the task to execute
	 *
	 * @return the {@link Disposable} instance that lets one cancel this particular task.
	 * If the {@link Scheduler} has been shut down, throw a {@link RejectedExecutionException}.
	 */
	Disposable schedule(Runnable task);

	/**
	 * Instructs this Scheduler to release all resources and reject
	 * any new tasks to be executed. Thread-safe and idempotent.
	 */
	@Override
	default void dispose() {
	}
}
