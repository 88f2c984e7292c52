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
 * A domain representation of an event delivered to an {@link Observer}: exactly one of
 * a value ({@link SignalType#ON_NEXT}), an error ({@link SignalType#ON_ERROR}) or a
 * completion ({@link SignalType#ON_COMPLETE}). The last two are terminal: once one has
 * reached a subscription nothing else does.
 *
 * @param <T> the value type
 */
public interface Signal<T> {

	/**
	 * Creates and returns a {@code Signal} of variety {@code Type.COMPLETE}.
	 *
	 * @param <T> the value type
	 * @return an {@code OnCompleted} variety of {@code Signal}
	 */
	static <T> Signal<T> complete() {
		return ImmutableSignal.onComplete();
	}

	/**
	 * Creates and returns a {@code Signal} of variety {@code Type.FAILED}, which holds
	 * the error.
	 *
	 * @param <T> the value type
	 * @param e the error associated to the signal
	 * @return an {@code OnError} variety of {@code Signal}
	 */
	static <T> Signal<T> error(Throwable e) {
		return new ImmutableSignal<>(SignalType.ON_ERROR, null, Objects.requireNonNull(e, "error"));
	}

	/**
	 * Creates and returns a {@code Signal} of variety {@code Type.NEXT}, which holds
	 * the value.
	 *
	 * @param <T> the value type
	 * @param t the value item associated to the signal, not null
	 * @return an {@code OnNext} variety of {@code Signal}
	 */
	static <T> Signal<T> next(T t) {
		return new ImmutableSignal<>(SignalType.ON_NEXT, Objects.requireNonNull(t, "value"), null);
	}

	/**
	 * Read the error associated with this (onError) signal.
	 *
	 * @return the Throwable associated with this (onError) signal, or null if not relevant
	 */
	@Nullable
	Throwable getThrowable();

	/**
	 * Retrieves the item associated with this (onNext) signal.
	 *
	 * @return the item associated to this (onNext) signal, or null if not relevant
	 */
	@Nullable
	T get();

	/**
	 * Read the type of this signal.
	 *
	 * @return the type of the signal
	 */
	SignalType getType();

	default boolean isOnNext() {
		return getType() == SignalType.ON_NEXT;
	}

	default boolean isOnError() {
		return getType() == SignalType.ON_ERROR;
	}

	default boolean isOnComplete() {
		return getType() == SignalType.ON_COMPLETE;
	}

	/**
	 * @return true if this signal closes the subscription it is delivered to
	 */
	default boolean isTerminal() {
		return getType().isTerminal();
	}
}
