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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.rivulet.core.Disposable;
import io.rivulet.core.Exceptions;
import io.rivulet.test.AssertObserver;
import io.rivulet.test.RaceTestUtils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublishSubjectTest {

	@Test
	void replaysNothing() {
		PublishSubject<String> subject = PublishSubject.create();
		AssertObserver<String> observer = new AssertObserver<>();

		subject.onNext("a");
		subject.subscribe(observer);
		subject.onNext("b");

		observer.assertValues("b").assertNotTerminated();
	}

	@Test
	void multicastsToAllSubscribers() {
		PublishSubject<Integer> subject = PublishSubject.create();
		AssertObserver<Integer> first = new AssertObserver<>();
		AssertObserver<Integer> second = new AssertObserver<>();
		subject.subscribe(first);
		subject.subscribe(second);

		subject.onNext(1);
		subject.onNext(2);
		subject.onComplete();

		first.assertValues(1, 2).assertComplete();
		second.assertValues(1, 2).assertComplete();
		assertThat(subject.hasObservers()).isFalse();
		assertThat(subject.hasComplete()).isTrue();
		assertThat(subject.isTerminated()).isTrue();
	}

	@Test
	void disposeDetachesOnlyThatSubscriber() {
		PublishSubject<Integer> subject = PublishSubject.create();
		AssertObserver<Integer> first = new AssertObserver<>();
		AssertObserver<Integer> second = new AssertObserver<>();
		Disposable d = subject.subscribe(first);
		subject.subscribe(second);

		subject.onNext(1);
		d.dispose();
		d.dispose();
		subject.onNext(2);

		first.assertValues(1);
		second.assertValues(1, 2);
		assertThat(subject.currentSubscriberCount()).isEqualTo(1);
		assertThat(d.isDisposed()).isTrue();
	}

	@Test
	void lateSubscriberGetsTerminalAndIsNotRetained() {
		PublishSubject<Integer> subject = PublishSubject.create();
		IllegalStateException boom = new IllegalStateException("boom");
		subject.onNext(1);
		subject.onError(boom);

		AssertObserver<Integer> late = new AssertObserver<>();
		subject.subscribe(late);

		late.assertNoValues().assertError(boom);
		assertThat(subject.currentSubscriberCount()).isZero();
		assertThat(subject.getThrowable()).isSameAs(boom);
		assertThat(subject.hasComplete()).isFalse();
	}

	@Test
	void signalsAfterTerminationAreDropped() {
		List<Object> droppedValues = new ArrayList<>();
		List<Throwable> droppedErrors = new ArrayList<>();
		Hooks.onNextDropped(droppedValues::add);
		Hooks.onErrorDropped(droppedErrors::add);
		PublishSubject<Integer> subject = PublishSubject.create();
		AssertObserver<Integer> observer = new AssertObserver<>();
		subject.subscribe(observer);

		subject.onComplete();
		subject.onNext(1);
		subject.onError(new IllegalStateException("late"));
		subject.onComplete();

		observer.assertNoValues().assertComplete();
		assertThat(droppedValues).containsExactly(1);
		assertThat(droppedErrors).hasSize(1);
	}

	@Test
	void throwingSubscriberIsErroredAndDetached() {
		PublishSubject<Integer> subject = PublishSubject.create();
		IllegalStateException boom = new IllegalStateException("boom");
		List<Throwable> errors = new ArrayList<>();
		AssertObserver<Integer> healthy = new AssertObserver<>();
		subject.subscribe(v -> { throw boom; }, errors::add);
		subject.subscribe(healthy);

		subject.onNext(1);
		subject.onNext(2);

		assertThat(errors).containsExactly(boom);
		healthy.assertValues(1, 2).assertNotTerminated();
		assertThat(subject.currentSubscriberCount()).isEqualTo(1);
	}

	@Test
	void reentrantEmissionIsSerialized() {
		PublishSubject<Integer> subject = PublishSubject.create();
		AtomicInteger depth = new AtomicInteger();
		AtomicInteger maxDepth = new AtomicInteger();
		List<Integer> received = new ArrayList<>();
		subject.subscribe(Observer.of(v -> {
			maxDepth.accumulateAndGet(depth.incrementAndGet(), Math::max);
			received.add(v);
			if (v < 3) {
				subject.onNext(v + 1);
			}
			depth.decrementAndGet();
		}, null, null));

		subject.onNext(1);

		assertThat(received).containsExactly(1, 2, 3);
		assertThat(maxDepth).hasValue(1);
	}

	@Test
	void subscriberAddedDuringEmissionOnlySeesNextOne() {
		PublishSubject<Integer> subject = PublishSubject.create();
		AssertObserver<Integer> late = new AssertObserver<>();
		AtomicReference<Disposable> lateHandle = new AtomicReference<>();
		subject.subscribe(Observer.of(v -> {
			if (lateHandle.get() == null) {
				lateHandle.set(subject.subscribe(late));
			}
		}, null, null));

		subject.onNext(1);
		subject.onNext(2);

		late.assertValues(2);
	}

	@Test
	void subscriberDisposingItselfDuringEmissionStopsReceiving() {
		PublishSubject<Integer> subject = PublishSubject.create();
		AtomicReference<Disposable> self = new AtomicReference<>();
		List<Integer> received = new ArrayList<>();
		self.set(subject.subscribe(Observer.of(v -> {
			received.add(v);
			self.get().dispose();
		}, null, null)));

		subject.onNext(1);
		subject.onNext(2);

		assertThat(received).containsExactly(1);
		assertThat(subject.hasObservers()).isFalse();
	}

	@Test
	void subscriberDisposedByAnotherDuringEmissionStillGetsThatEmission() {
		PublishSubject<Integer> subject = PublishSubject.create();
		AtomicReference<Disposable> second = new AtomicReference<>();
		AssertObserver<Integer> secondObserver = new AssertObserver<>();
		subject.subscribe(Observer.of(v -> second.get().dispose(), null, null));
		second.set(subject.subscribe(secondObserver));

		subject.onNext(1);
		subject.onNext(2);

		secondObserver.assertValues(1).assertNotTerminated();
		assertThat(second.get().isDisposed()).isTrue();
		assertThat(subject.currentSubscriberCount()).isEqualTo(1);
	}

	@Test
	void failingDropHookDoesNotStarveLaterSubscribers() {
		Hooks.onErrorDropped(e -> {
			throw new IllegalStateException("hook failure");
		});
		PublishSubject<Integer> subject = PublishSubject.create();
		AssertObserver<Integer> last = new AssertObserver<>();
		subject.subscribe(Observer.of(v -> {
			throw new IllegalArgumentException("boom");
		}, null, null));
		subject.subscribe(last);

		assertThatThrownBy(() -> subject.onNext(1)).isInstanceOf(IllegalStateException.class)
		                                           .hasMessage("hook failure");
		last.assertValues(1);

		subject.onNext(2);

		last.assertValues(1, 2).assertNotTerminated();
		assertThat(subject.currentSubscriberCount()).isEqualTo(1);
	}

	@Test
	void failModeDropIsRethrownAfterEveryEntryDrained() {
		List<Throwable> droppedErrors = new ArrayList<>();
		Hooks.onErrorDropped(droppedErrors::add);
		Hooks.onNextDroppedFail();
		PublishSubject<Integer> subject = PublishSubject.create();
		AssertObserver<Integer> last = new AssertObserver<>();
		subject.subscribe(Observer.of(v -> {
			if (v == 1) {
				subject.onNext(2);
			}
			throw new IllegalArgumentException("boom");
		}, null, null));
		subject.subscribe(last);

		assertThatThrownBy(() -> subject.onNext(1)).matches(Exceptions::isContractViolation)
		                                           .hasMessageContaining("onNext(2)");
		last.assertValues(1, 2);
		assertThat(droppedErrors).singleElement()
		                         .matches(Exceptions::isErrorCallbackNotImplemented);

		subject.onNext(3);

		last.assertValues(1, 2, 3);
	}

	@Test
	void concurrentTerminationDeliversExactlyOneTerminal() {
		for (int i = 0; i < 500; i++) {
			PublishSubject<Integer> subject = PublishSubject.create();
			AssertObserver<Integer> first = new AssertObserver<>();
			AssertObserver<Integer> second = new AssertObserver<>();
			subject.subscribe(first);
			subject.subscribe(second);
			Hooks.resetOnErrorDropped();
			Hooks.onErrorDropped(e -> { });

			RaceTestUtils.race(subject::onComplete,
					() -> subject.onError(new IllegalStateException("race")));

			assertThat(first.terminals()).as("round " + i).hasSize(1);
			assertThat(second.terminals()).as("round " + i).isEqualTo(first.terminals());
		}
	}

	@Test
	void concurrentProducersNeverOverlapDeliveries() {
		for (int i = 0; i < 100; i++) {
			PublishSubject<Integer> subject = PublishSubject.create();
			AtomicInteger inFlight = new AtomicInteger();
			List<Integer> overlaps = new CopyOnWriteArrayList<>();
			List<Integer> received = new CopyOnWriteArrayList<>();
			subject.subscribe(Observer.of(v -> {
				if (inFlight.incrementAndGet() != 1) {
					overlaps.add(v);
				}
				received.add(v);
				inFlight.decrementAndGet();
			}, null, null));

			RaceTestUtils.race(() -> {
				for (int j = 0; j < 50; j++) {
					subject.onNext(j);
				}
			}, () -> {
				for (int j = 50; j < 100; j++) {
					subject.onNext(j);
				}
			});

			assertThat(overlaps).as("round " + i).isEmpty();
			assertThat(received).as("round " + i).hasSize(100);
		}
	}

	@Test
	void subscribeRacingWithCompleteAlwaysTerminates() {
		for (int i = 0; i < 500; i++) {
			PublishSubject<Integer> subject = PublishSubject.create();
			AssertObserver<Integer> observer = new AssertObserver<>();

			RaceTestUtils.race(() -> subject.subscribe(observer), subject::onComplete);

			observer.assertComplete();
			assertThat(subject.currentSubscriberCount()).isZero();
		}
	}

	@Test
	void subjectCanObserveAStream() {
		PublishSubject<String> subject = PublishSubject.create();
		AssertObserver<String> observer = new AssertObserver<>();
		subject.subscribe(observer);

		EventStream.just("a", "b").subscribe(subject);

		observer.assertValues("a", "b").assertComplete();
	}
}
