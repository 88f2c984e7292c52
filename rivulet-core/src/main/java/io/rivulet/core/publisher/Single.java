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
import java.util.function.Consumer;
import java.util.function.Function;

import io.rivulet.core.Disposable;
import org.jspecify.annotations.Nullable;

/**
 * A cold source producing exactly one value or an error. On the underlying
 * {@link EventStream} a success is a value immediately followed by a completion.
 *
 * @param <T> the value type
 */
public final class Single<T> {

	/**
	 * Programmatically create a {@link Single}. The activation runs once per subscriber
	 * and returns the {@link Disposable} releasing its resources, or null.
	 *
	 * @param activation the per-subscriber activation
	 * @param <T> the value type
	 * @return a new {@link Single}
	 */
	public static <T> Single<T> create(Function<? super SingleEmitter<T>, ? extends @Nullable Disposable> activation) {
		Objects.requireNonNull(activation, "activation");
		return new Single<>(EventStream.<T>create(e -> activation.apply(new BoundedEmitter<>(e, "Single", false))));
	}

	/**
	 * @param value the value to produce
	 * @param <T> the value type
	 * @return a {@link Single} producing {@code value} to each subscriber
	 */
	public static <T> Single<T> just(T value) {
		Objects.requireNonNull(value, "value");
		return create(emitter -> {
			emitter.success(value);
			return null;
		});
	}

	/**
	 * @param error the error to produce
	 * @param <T> the value type
	 * @return a {@link Single} failing each subscriber with {@code error}
	 */
	public static <T> Single<T> error(Throwable error) {
		Objects.requireNonNull(error, "error");
		return create(emitter -> {
			emitter.error(error);
			return null;
		});
	}

	final EventStream<T> source;

	Single(EventStream<T> source) {
		this.source = source;
	}

	/**
	 * Subscribe a value callback, errors being reported to
	 * {@link Hooks#onErrorDropped(Consumer)}.
	 *
	 * @param onSuccess the value callback
	 * @return a {@link Disposable} ending the subscription
	 */
	public Disposable subscribe(Consumer<? super T> onSuccess) {
		Objects.requireNonNull(onSuccess, "onSuccess");
		return source.subscribe(onSuccess, null, null);
	}

	/**
	 * @param onSuccess the value callback
	 * @param onError the error callback
	 * @return a {@link Disposable} ending the subscription
	 */
	public Disposable subscribe(Consumer<? super T> onSuccess, Consumer<? super Throwable> onError) {
		Objects.requireNonNull(onSuccess, "onSuccess");
		return source.subscribe(onSuccess, onError);
	}

	/**
	 * @return this {@link Single} as an {@link EventStream} of one value then completion
	 */
	public EventStream<T> asStream() {
		return source;
	}

	@Override
	public String toString() {
		return "Single";
	}
}
