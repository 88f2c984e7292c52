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

package io.rivulet.core;

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

/**
 * A once-only latch guarding the terminal state of a subscription (or of a whole subject).
 * It starts open and can be {@link #stop() stopped} exactly once: among any number of
 * threads racing to stop it, a single one wins and is allowed to forward a terminal
 * signal, all others observe it as already stopped.
 * <p>
 * Every adapter that delivers signals to a subscriber composes one of these rather than
 * tracking its own flag.
 */
public final class TerminalGuard {

	static final int OPEN    = 0;
	static final int STOPPED = 1;

	volatile int state;
	static final AtomicIntegerFieldUpdater<TerminalGuard> STATE =
			AtomicIntegerFieldUpdater.newUpdater(TerminalGuard.class, "state");

	/**
	 * Attempt the open to stopped transition.
	 *
	 * @return true if this call performed the transition, false if the guard was
	 * already stopped
	 */
	public boolean stop() {
		return state == OPEN && STATE.compareAndSet(this, OPEN, STOPPED);
	}

	/**
	 * @return true if the guard has been stopped
	 */
	public boolean isStopped() {
		return state == STOPPED;
	}

	/**
	 * @return true if the guard is still open, ie. events may still be forwarded
	 */
	public boolean isOpen() {
		return state == OPEN;
	}

	@Override
	public String toString() {
		return isStopped() ? "TerminalGuard[stopped]" : "TerminalGuard[open]";
	}
}
