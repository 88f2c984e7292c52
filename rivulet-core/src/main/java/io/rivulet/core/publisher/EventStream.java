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

import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import io.rivulet.core.Disposable;
import org.jspecify.annotations.Nullable;
import org.reactivestreams.Publisher;

/**
 * A push-based source of 0 to N values, optionally terminated by either a completion
 * or an error.
 * <p>
 * Streams obtained from {@link #create(Function)} and the other factories are cold:
 * nothing happens until {@link #subscribe(Observer)} is called, and each subscription
 * runs its own activation. The {@link Disposable} returned by every {@code subscribe}
 * variant stops the delivery to that subscriber and releases the resources of its
 * activation, leaving other subscriptions untouched.
 * <p>
 * Each subscriber observes {@code onNext* (onError | onComplete)?}: nothing follows a
 * terminal signal and values emitted after disposal are dropped.
 *
 * @param <T> the element type of this stream
 *
 * @see Subject
 */
public abstract class EventStream<T> {

	//	 ==============================================================================================================
	//	 Static Generators
	//	 ==============================================================================================================

	/**
	 * Programmatically create an {@link EventStream}. The activation runs once per
	 * subscriber with an {@link Emitter} bound to that subscriber, and returns the
	 * {@link Disposable} releasing whatever it set up, or null when there is nothing to
	 * release. That resource is disposed on the first of: termination, disposal of the
	 * subscription.
	 * <p>
	 * An activation throwing an exception terminates its subscriber with that error.
	 * <pre><code>
	 * EventStream.&lt;String&gt;create(emitter -&gt; {
	 *     Listener l = emitter::onNext;
	 *     source.register(l);
	 *     return () -&gt; source.unregister(l);
	 * });
	 * </code></pre>
	 *
	 * @param activation the per-subscriber activation
	 * @param <T> the value type
	 * @return a new cold {@link EventStream}
	 */
	public static <T> EventStream<T> create(Function<? super Emitter<T>, ? extends @Nullable Disposable> activation) {
		return new EventStreamCreate<>(activation);
	}

	/**
	 * Create an {@link EventStream} that emits the provided elements and then completes.
	 *
	 * @param data the elements to emit
	 * @param <T> the emitted data type
	 * @return a new {@link EventStream}
	 */
	@SafeVarargs
	public static <T> EventStream<T> just(T... data) {
		return fromIterable(Arrays.asList(data));
	}

	/**
	 * Create an {@link EventStream} that emits the items contained in the provided
	 * {@link Iterable}, in iteration order. A new {@link Iterator} is obtained for each
	 * subscriber and emission stops as soon as the subscription is disposed.
	 *
	 * @param it the {@link Iterable} to read data from
	 * @param <T> the emitted data type
	 * @return a new {@link EventStream}
	 */
	public static <T> EventStream<T> fromIterable(Iterable<? extends T> it) {
		Objects.requireNonNull(it, "iterable");
		return create(emitter -> {
			Iterator<? extends T> iterator = it.iterator();
			while (iterator.hasNext()) {
				if (emitter.isDisposed()) {
					return null;
				}
				emitter.onNext(Objects.requireNonNull(iterator.next(), "The iterator returned a null value"));
			}
			emitter.onComplete();
			return null;
		});
	}

	/**
	 * Create an {@link EventStream} that completes without emitting any item.
	 *
	 * @param <T> the reified type of the target {@link Observer}
	 * @return an empty {@link EventStream}
	 */
	public static <T> EventStream<T> empty() {
		return create(emitter -> {
			emitter.onComplete();
			return null;
		});
	}

	/**
	 * Create an {@link EventStream} that terminates with the specified error immediately
	 * after being subscribed to.
	 *
	 * @param error the error to signal to each {@link Observer}
	 * @param <T> the reified type of the target {@link Observer}
	 * @return a new failing {@link EventStream}
	 */
	public static <T> EventStream<T> error(Throwable error) {
		Objects.requireNonNull(error, "error");
		return create(emitter -> {
			emitter.onError(error);
			return null;
		});
	}

	/**
	 * Create an {@link EventStream} that will never signal any data, error or completion
	 * signal. Its subscriptions only end by disposal.
	 *
	 * @param <T> the reified type of the target {@link Observer}
	 * @return a never completing {@link EventStream}
	 */
	public static <T> EventStream<T> never() {
		return create(emitter -> null);
	}

	/**
	 * Lazily supply an {@link EventStream} every time the returned stream is subscribed
	 * to. A supplier throwing terminates that subscriber with the error.
	 *
	 * @param supplier the {@link EventStream} {@link Supplier} to call on subscribe
	 * @param <T> the type of values passing through the {@link EventStream}
	 * @return a deferred {@link EventStream}
	 */
	public static <T> EventStream<T> defer(Supplier<? extends EventStream<? extends T>> supplier) {
		Objects.requireNonNull(supplier, "supplier");
		return create(emitter -> Objects.requireNonNull(supplier.get(),
				"The supplier returned a null EventStream").subscribe(emitter));
	}

	/**
	 * Expose a Reactive Streams {@link Publisher} as an {@link EventStream}. Each
	 * subscription subscribes to the publisher with an unbounded demand and cancels the
	 * upstream {@link org.reactivestreams.Subscription} when disposed.
	 *
	 * @param source the {@link Publisher} to adapt
	 * @param <T> the value type
	 * @return a new {@link EventStream}
	 */
	public static <T> EventStream<T> fromPublisher(Publisher<? extends T> source) {
		Objects.requireNonNull(source, "source");
		return create(emitter -> {
			EventStreamFromPublisher.PublisherSubscriber<T> subscriber =
					new EventStreamFromPublisher.PublisherSubscriber<>(emitter);
			source.subscribe(subscriber);
			return subscriber;
		});
	}

	//	 ==============================================================================================================
	//	 Subscription
	//	 ==============================================================================================================

	/**
	 * Subscribe an {@link Observer} to this stream.
	 *
	 * @param observer the {@link Observer} receiving the signals
	 * @return a {@link Disposable} ending this subscription and releasing its resources
	 */
	public abstract Disposable subscribe(Observer<? super T> observer);

	/**
	 * Subscribe to this stream and trigger its activation, ignoring the values. An error
	 * is reported to {@link Hooks#onErrorDropped(Consumer)}.
	 *
	 * @return a new {@link Disposable} that can be used to end the subscription
	 */
	public final Disposable subscribe() {
		return subscribe(new LambdaObserver<T>(null, null, null));
	}

	/**
	 * Subscribe {@link Consumer} callbacks to the values and the error of this stream.
	 *
	 * @param consumer the consumer to invoke on each value
	 * @param errorConsumer the consumer to invoke on error signal
	 * @return a new {@link Disposable} that can be used to end the subscription
	 */
	public final Disposable subscribe(@Nullable Consumer<? super T> consumer,
			Consumer<? super Throwable> errorConsumer) {
		Objects.requireNonNull(errorConsumer, "errorConsumer");
		return subscribe(new LambdaObserver<T>(consumer, errorConsumer, null));
	}

	/**
	 * Subscribe {@link Consumer} callbacks to all the signals of this stream.
	 *
	 * @param consumer the consumer to invoke on each value
	 * @param errorConsumer the consumer to invoke on error signal
	 * @param completeConsumer the callback to invoke on completion signal
	 * @return a new {@link Disposable} that can be used to end the subscription
	 */
	public final Disposable subscribe(@Nullable Consumer<? super T> consumer,
			@Nullable Consumer<? super Throwable> errorConsumer,
			@Nullable Runnable completeConsumer) {
		return subscribe(new LambdaObserver<T>(consumer, errorConsumer, completeConsumer));
	}

	/**
	 * Subscribe an {@link Observer} and hand the resulting subscription over to the given
	 * bag, so that disposing the bag ends it.
	 *
	 * @param bag the {@link Disposable.Composite} owning the subscription
	 * @param observer the {@link Observer} receiving the signals
	 * @return the {@link Disposable} of the subscription, also added to the bag
	 */
	public final Disposable subscribe(Disposable.Composite bag, Observer<? super T> observer) {
		Objects.requireNonNull(bag, "bag");
		return subscribe(observer).disposeWith(bag);
	}

	/**
	 * Subscribe {@link Consumer} callbacks and hand the resulting subscription over to
	 * the given bag.
	 *
	 * @param bag the {@link Disposable.Composite} owning the subscription
	 * @param consumer the consumer to invoke on each value
	 * @param errorConsumer the consumer to invoke on error signal
	 * @return the {@link Disposable} of the subscription, also added to the bag
	 */
	public final Disposable subscribe(Disposable.Composite bag,
			@Nullable Consumer<? super T> consumer,
			Consumer<? super Throwable> errorConsumer) {
		Objects.requireNonNull(bag, "bag");
		return subscribe(consumer, errorConsumer).disposeWith(bag);
	}

	//	 ==============================================================================================================
	//	 Interop
	//	 ==============================================================================================================

	/**
	 * Expose this stream as a Reactive Streams {@link Publisher}. A subscription is
	 * activated on the first {@link org.reactivestreams.Subscription#request(long)};
	 * values arriving without outstanding demand terminate it with an overflow error,
	 * and a non-positive request terminates it with an {@link IllegalArgumentException}.
	 *
	 * @return a {@link Publisher} view of this stream
	 */
	public final Publisher<T> toPublisher() {
		return new EventStreamPublisher<>(this);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
