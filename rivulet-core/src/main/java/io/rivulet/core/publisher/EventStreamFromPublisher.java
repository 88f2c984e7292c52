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

import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import io.rivulet.core.Disposable;
import org.jspecify.annotations.Nullable;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * Bridges a Reactive Streams {@link org.reactivestreams.Publisher} into an
 * {@link Emitter}: unbounded demand upstream, cancellation on disposal.
 */
final class EventStreamFromPublisher {

	static final class PublisherSubscriber<T> implements Subscriber<T>, Disposable {

		final Emitter<T> actual;

		volatile @Nullable Subscription s;
		@SuppressWarnings("rawtypes")
		static final AtomicReferenceFieldUpdater<PublisherSubscriber, Subscription> S =
				AtomicReferenceFieldUpdater.newUpdater(PublisherSubscriber.class, Subscription.class, "s");

		PublisherSubscriber(Emitter<T> actual) {
			this.actual = actual;
		}

		@Override
		public void onSubscribe(Subscription s) {
			if (S.compareAndSet(this, null, s)) {
				s.request(Long.MAX_VALUE);
				return;
			}
			s.cancel();
			if (this.s != CancelledSubscription.INSTANCE) {
				Operators.onContractViolation("Reactive Streams rule 2.12 - Subscriber.onSubscribe MUST NOT be called more than once");
			}
		}

		@Override
		public void onNext(T t) {
			actual.onNext(t);
		}

		@Override
		public void onError(Throwable t) {
			actual.onError(t);
		}

		@Override
		public void onComplete() {
			actual.onComplete();
		}

		@Override
		public void dispose() {
			Subscription a = S.getAndSet(this, CancelledSubscription.INSTANCE);
			if (a != null && a != CancelledSubscription.INSTANCE) {
				a.cancel();
			}
		}

		@Override
		public boolean isDisposed() {
			return s == CancelledSubscription.INSTANCE;
		}
	}

	/**
	 * Marks a subscriber whose upstream was cancelled, possibly before it arrived.
	 */
	enum CancelledSubscription implements Subscription {
		INSTANCE;

		@Override
		public void request(long n) {
			// deliberately no op
		}

		@Override
		public void cancel() {
			// deliberately no op
		}
	}

	EventStreamFromPublisher() {
	}
}
