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
 * A cold source producing at most one value, then completing, or an error. Lambda
 * subscribers get either the value callback or the completion callback, never both.
 *
 * @param <T> the value type
 */
public final class Maybe<T> {

	/**
	 * Programmatically create a {@link Maybe}. The activation runs once per subscriber
	 * and returns the {@link Disposable} releasing its resources, or null.
	 *
	 * @param activation the per-subscriber activation
	 * @param <T> the value type
	 * @return a new {@link Maybe}
	 */
	public static <T> Maybe<T> create(Function<? super MaybeEmitter<T>, ? extends @Nullable Disposable> activation) {
		Objects.requireNonNull(activation, "activation");
		return new Maybe<>(EventStream.<T>create(e -> activation.apply(new BoundedEmitter<>(e, "Maybe", true))));
	}

	/**
	 * @param value the value to produce
	 * @param <T> the value type
	 * @return a {@link Maybe} producing {@code value} to each subscriber
	 */
	public static <T> Maybe<T> just(T value) {
		Objects.requireNonNull(value, "value");
		return create(emitter -> {
			emitter.success(value);
			return null;
		});
	}

	/**
	 * @param <T> the value type
	 * @return a {@link Maybe} completing each subscriber without value
	 */
	public static <T> Maybe<T> empty() {
		return create(emitter -> {
			emitter.complete();
			return null;
		});
	}

	/**
	 * @param error the error to produce
	 * @param <T> the value type
	 * @return a {@link Maybe} failing each subscriber with {@code error}
	 */
	public static <T> Maybe<T> error(Throwable error) {
		Objects.requireNonNull(error, "error");
		return create(emitter -> {
			emitter.error(error);
			return null;
		});
	}

	final EventStream<T> source;

	Maybe(EventStream<T> source) {
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
		return subscribe(onSuccess, null, null);
	}

	/**
	 * @param onSuccess the value callback
	 * @param onError the error callback
	 * @return a {@link Disposable} ending the subscription
	 */
	public Disposable subscribe(Consumer<? super T> onSuccess, Consumer<? super Throwable> onError) {
		Objects.requireNonNull(onError, "onError");
		return subscribe(onSuccess, onError, null);
	}

	/**
	 * @param onSuccess the value callback
	 * @param onError the error callback
	 * @param onComplete the callback invoked when completing without value
	 * @return a {@link Disposable} ending the subscription
	 */
	public Disposable subscribe(Consumer<? super T> onSuccess,
			@Nullable Consumer<? super Throwable> onError,
			@Nullable Runnable onComplete) {
		Objects.requireNonNull(onSuccess, "onSuccess");
		return source.subscribe(new MaybeObserver<T>(new LambdaObserver<T>(onSuccess, onError, onComplete)));
	}

	/**
	 * @return this {@link Maybe} as an {@link EventStream} of at most one value
	 */
	public EventStream<T> asStream() {
		return source;
	}

	@Override
	public String toString() {
		return "Maybe";
	}

	/**
	 * Suppresses the completion callback after a value. Deliveries are serialized by
	 * the emitter, no synchronization needed.
	 */
	static final class MaybeObserver<T> implements Observer<T> {

		final LambdaObserver<T> delegate;

		boolean hasValue;

		MaybeObserver(LambdaObserver<T> delegate) {
			this.delegate = delegate;
		}

		@Override
		public void on(Signal<? extends T> signal) {
			switch (signal.getType()) {
				case ON_NEXT:
					onNext(Objects.requireNonNull(signal.get(), "value"));
					break;
				case ON_ERROR:
					onError(Objects.requireNonNull(signal.getThrowable(), "throwable"));
					break;
				default:
					onComplete();
			}
		}

		@Override
		public void onNext(T t) {
			hasValue = true;
			delegate.onNext(t);
		}

		@Override
		public void onError(Throwable e) {
			delegate.onError(e);
		}

		@Override
		public void onComplete() {
			if (!hasValue) {
				delegate.onComplete();
			}
		}
	}
}
