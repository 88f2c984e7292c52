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
 * A cold source that only signals completion or an error.
 */
public final class Completable {

	/**
	 * Programmatically create a {@link Completable}. The activation runs once per
	 * subscriber and returns the {@link Disposable} releasing its resources, or null.
	 *
	 * @param activation the per-subscriber activation
	 * @return a new {@link Completable}
	 */
	public static Completable create(Function<? super CompletableEmitter, ? extends @Nullable Disposable> activation) {
		Objects.requireNonNull(activation, "activation");
		return new Completable(EventStream.<Void>create(e -> activation.apply(new BoundedEmitter<>(e, "Completable", false))));
	}

	/**
	 * @return a {@link Completable} completing each subscriber immediately
	 */
	public static Completable complete() {
		return create(emitter -> {
			emitter.complete();
			return null;
		});
	}

	/**
	 * @param error the error to produce
	 * @return a {@link Completable} failing each subscriber with {@code error}
	 */
	public static Completable error(Throwable error) {
		Objects.requireNonNull(error, "error");
		return create(emitter -> {
			emitter.error(error);
			return null;
		});
	}

	final EventStream<Void> source;

	Completable(EventStream<Void> source) {
		this.source = source;
	}

	/**
	 * Subscribe and ignore the outcome, errors being reported to
	 * {@link Hooks#onErrorDropped(Consumer)}.
	 *
	 * @return a {@link Disposable} ending the subscription
	 */
	public Disposable subscribe() {
		return source.subscribe();
	}

	/**
	 * @param onComplete the completion callback
	 * @return a {@link Disposable} ending the subscription
	 */
	public Disposable subscribe(Runnable onComplete) {
		Objects.requireNonNull(onComplete, "onComplete");
		return source.subscribe(null, null, onComplete);
	}

	/**
	 * @param onComplete the completion callback
	 * @param onError the error callback
	 * @return a {@link Disposable} ending the subscription
	 */
	public Disposable subscribe(Runnable onComplete, Consumer<? super Throwable> onError) {
		Objects.requireNonNull(onComplete, "onComplete");
		Objects.requireNonNull(onError, "onError");
		return source.subscribe(null, onError, onComplete);
	}

	/**
	 * @return this {@link Completable} as an {@link EventStream} without values
	 */
	public EventStream<Void> asStream() {
		return source;
	}

	@Override
	public String toString() {
		return "Completable";
	}
}
