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

import org.jspecify.annotations.Nullable;

/**
 * A {@link Subject} that remembers the latest value (or the seed it was created with)
 * and hands it to each new subscriber before the live signals. Subscribers arriving
 * after the termination only receive the terminal signal.
 *
 * @param <T> the value type
 */
public final class BehaviorSubject<T> extends Subject<T> {

	/**
	 * Create a {@link BehaviorSubject} without initial value.
	 *
	 * @param <T> the value type
	 * @return a new {@link BehaviorSubject}
	 */
	public static <T> BehaviorSubject<T> create() {
		return new BehaviorSubject<>(null);
	}

	/**
	 * Create a {@link BehaviorSubject} replaying {@code seed} until a first value is
	 * emitted.
	 *
	 * @param seed the initial value
	 * @param <T> the value type
	 * @return a new {@link BehaviorSubject}
	 */
	public static <T> BehaviorSubject<T> create(T seed) {
		return new BehaviorSubject<>(Objects.requireNonNull(seed, "seed"));
	}

	//guarded by this
	@Nullable T value;

	BehaviorSubject(@Nullable T seed) {
		this.value = seed;
	}

	@Override
	void record(T value) {
		this.value = value;
	}

	@Override
	void replay(SubjectInner<T> inner) {
		T v = value;
		if (v != null && terminal == null) {
			inner.enqueue(Signal.next(v));
		}
	}

	/**
	 * @return the latest value or seed, null if there is none or the subject terminated
	 */
	public @Nullable T getValue() {
		synchronized (this) {
			return terminal == null ? value : null;
		}
	}

	/**
	 * @return true if {@link #getValue()} would return a value
	 */
	public boolean hasValue() {
		return getValue() != null;
	}
}
