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

import io.rivulet.core.Disposable;
import io.rivulet.core.Disposables;

/**
 * Executes tasks on the caller's thread immediately.
 */
final class ImmediateScheduler implements Scheduler {

	private static final ImmediateScheduler INSTANCE = new ImmediateScheduler();

	static Scheduler instance() {
		return INSTANCE;
	}

	private ImmediateScheduler() {
	}

	static final Disposable FINISHED = Disposables.disposed();

	@Override
	public Disposable schedule(Runnable task) {
		task.run();
		return FINISHED;
	}

	@Override
	public void dispose() {
		//NO-OP
	}

	@Override
	public String toString() {
		return "Schedulers." + Schedulers.IMMEDIATE + "()";
	}
}
