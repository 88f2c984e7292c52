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

package io.rivulet.core.publisher;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.function.Consumer;

import io.rivulet.core.Exceptions;
import io.rivulet.util.Logger;
import io.rivulet.util.Loggers;
import io.rivulet.util.Metrics;
import org.jspecify.annotations.Nullable;

/**
 * A helper to support "Operator" writing: demand accounting and reporting of signals
 * that could not be delivered.
 */
public abstract class Operators {

	/**
	 * Cap an addition to Long.MAX_VALUE
	 *
	 * @param a left operand
	 * @param b right operand
	 *
	 * @return Addition result or Long.MAX_VALUE if overflow
	 */
	public static long addCap(long a, long b) {
		long res = a + b;
		if (res < 0L) {
			return Long.MAX_VALUE;
		}
		return res;
	}

	/**
	 * Concurrent addition bound to Long.MAX_VALUE.
	 * Any concurrent write will "happen before" this operation.
	 *
	 * @param <T> the parent instance type
	 * @param updater  current field updater
	 * @param instance current instance to update
	 * @param toAdd    delta to add
	 * @return value before addition or Long.MAX_VALUE
	 */
	public static <T> long addCap(AtomicLongFieldUpdater<T> updater, T instance, long toAdd) {
		long r, u;
		for (;;) {
			r = updater.get(instance);
			if (r == Long.MAX_VALUE) {
				return Long.MAX_VALUE;
			}
			u = addCap(r, toAdd);
			if (updater.compareAndSet(instance, r, u)) {
				return r;
			}
		}
	}

	/**
	 * Concurrent subtraction bound to 0, unless the current value is Long.MAX_VALUE
	 * which stands for unbounded demand.
	 *
	 * @param <T> the parent instance type
	 * @param updater  current field updater
	 * @param instance current instance to update
	 * @param toSub    delta to subtract
	 * @return value after subtraction or Long.MAX_VALUE
	 */
	public static <T> long produced(AtomicLongFieldUpdater<T> updater, T instance, long toSub) {
		long r, u;
		for (;;) {
			r = updater.get(instance);
			if (r == 0 || r == Long.MAX_VALUE) {
				return r;
			}
			u = r - toSub;
			if (u < 0) {
				u = 0;
			}
			if (updater.compareAndSet(instance, r, u)) {
				return u;
			}
		}
	}

	/**
	 * An unexpected error is about to be dropped.
	 * <p>
	 * If no hook is registered for {@link Hooks#onErrorDropped(Consumer)}, the dropped
	 * error is logged at ERROR level.
	 *
	 * @param e the dropped error
	 */
	public static void onErrorDropped(Throwable e) {
		Objects.requireNonNull(e, "onError");
		Metrics.recordDroppedSignal(SignalType.ON_ERROR.toString());
		Consumer<? super Throwable> hook = Hooks.onErrorDroppedHook;
		if (hook == null) {
			log.error("Operator called default onErrorDropped", e);
			return;
		}
		hook.accept(e);
	}

	/**
	 * An unexpected event is about to be dropped.
	 * <p>
	 * If no hook is registered for {@link Hooks#onNextDropped(Consumer)}, the dropped
	 * element is just logged at DEBUG level.
	 *
	 * @param <T> the dropped value type
	 * @param t the dropped data
	 */
	public static <T> void onNextDropped(T t) {
		Objects.requireNonNull(t, "onNext");
		Metrics.recordDroppedSignal(SignalType.ON_NEXT.toString());
		Consumer<Object> hook = Hooks.onNextDroppedHook;
		if (hook != null) {
			hook.accept(t);
		}
		else if (log.isDebugEnabled()) {
			log.debug("onNextDropped: " + t);
		}
	}

	/**
	 * A completion arrived after its subscription was already terminated or disposed.
	 * There is nothing to hand to a hook, the drop is logged at DEBUG level.
	 */
	public static void onCompleteDropped() {
		Metrics.recordDroppedSignal(SignalType.ON_COMPLETE.toString());
		if (log.isDebugEnabled()) {
			log.debug("onCompleteDropped");
		}
	}

	/**
	 * Report a misuse of a producer API, e.g. a second value given to a single-valued
	 * producer. The violation is never thrown at the caller: it goes through
	 * {@link #onErrorDropped(Throwable)}.
	 *
	 * @param message the violation description
	 */
	public static void onContractViolation(String message) {
		Throwable e = Exceptions.failWithContractViolation(message);
		Metrics.recordContractViolation();
		onErrorDropped(e);
	}

	/**
	 * Report a misuse that carries the value which could not be produced. The value
	 * goes to {@link #onNextDropped(Object)} and the violation to
	 * {@link #onContractViolation(String)}.
	 *
	 * @param message the violation description
	 * @param value the rejected value, if any
	 */
	public static void onContractViolation(String message, @Nullable Object value) {
		if (value != null) {
			onNextDropped(value);
		}
		onContractViolation(message);
	}

	Operators() {
	}

	static final Logger log = Loggers.getLogger(Operators.class);
}
