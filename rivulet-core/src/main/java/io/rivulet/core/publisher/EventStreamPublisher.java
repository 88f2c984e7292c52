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
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import io.rivulet.core.Disposable;
import io.rivulet.core.Disposables;
import io.rivulet.core.Exceptions;
import io.rivulet.core.TerminalGuard;
import org.jspecify.annotations.Nullable;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * A Reactive Streams {@link Publisher} view of an {@link EventStream}. The stream being
 * push-based, demand is only checked: a value arriving without outstanding request
 * terminates the subscriber with an overflow error.
 *
 * @param <T> the value type
 */
final class EventStreamPublisher<T> implements Publisher<T> {

	final EventStream<T> source;

	EventStreamPublisher(EventStream<T> source) {
		this.source = source;
	}

	@Override
	public void subscribe(Subscriber<? super T> actual) {
		Objects.requireNonNull(actual, "subscriber");
		actual.onSubscribe(new DemandSubscription<>(actual, source));
	}

	@Override
	public String toString() {
		return "EventStreamPublisher{" + source + "}";
	}

	static final class DemandSubscription<T> implements Subscription, Observer<T> {

		final Subscriber<? super T> actual;
		final EventStream<T>        source;
		final TerminalGuard         done = new TerminalGuard();

		volatile long requested;
		@SuppressWarnings("rawtypes")
		static final AtomicLongFieldUpdater<DemandSubscription> REQUESTED =
				AtomicLongFieldUpdater.newUpdater(DemandSubscription.class, "requested");

		volatile int activated;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<DemandSubscription> ACTIVATED =
				AtomicIntegerFieldUpdater.newUpdater(DemandSubscription.class, "activated");

		volatile @Nullable Disposable upstream;
		@SuppressWarnings("rawtypes")
		static final AtomicReferenceFieldUpdater<DemandSubscription, Disposable> UPSTREAM =
				AtomicReferenceFieldUpdater.newUpdater(DemandSubscription.class, Disposable.class, "upstream");

		DemandSubscription(Subscriber<? super T> actual, EventStream<T> source) {
			this.actual = actual;
			this.source = source;
		}

		@Override
		public void request(long n) {
			if (n <= 0) {
				Disposables.dispose(UPSTREAM, this);
				if (done.stop()) {
					actual.onError(Exceptions.nullOrNegativeRequestException(n));
				}
				return;
			}
			Operators.addCap(REQUESTED, this, n);
			if (activated == 0 && ACTIVATED.compareAndSet(this, 0, 1)) {
				Disposables.replace(UPSTREAM, this, source.subscribe(this));
			}
		}

		@Override
		public void cancel() {
			done.stop();
			Disposables.dispose(UPSTREAM, this);
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
			if (done.isStopped()) {
				Operators.onNextDropped(t);
				return;
			}
			if (requested == 0L) {
				Disposables.dispose(UPSTREAM, this);
				if (done.stop()) {
					actual.onError(Exceptions.failWithOverflow(
							"Could not emit value due to lack of requests"));
				}
				Operators.onNextDropped(t);
				return;
			}
			actual.onNext(t);
			Operators.produced(REQUESTED, this, 1L);
		}

		@Override
		public void onError(Throwable e) {
			if (!done.stop()) {
				Operators.onErrorDropped(e);
				return;
			}
			Disposables.dispose(UPSTREAM, this);
			actual.onError(e);
		}

		@Override
		public void onComplete() {
			if (!done.stop()) {
				Operators.onCompleteDropped();
				return;
			}
			Disposables.dispose(UPSTREAM, this);
			actual.onComplete();
		}
	}
}
