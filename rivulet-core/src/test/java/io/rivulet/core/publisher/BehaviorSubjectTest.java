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

import io.rivulet.test.AssertObserver;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BehaviorSubjectTest {

	@Test
	void replaysSeedThenLatestValue() {
		BehaviorSubject<String> subject = BehaviorSubject.create("x");
		AssertObserver<String> early = new AssertObserver<>();
		AssertObserver<String> late = new AssertObserver<>();

		subject.subscribe(early);
		subject.onNext("a");
		subject.subscribe(late);
		subject.onNext("b");

		early.assertValues("x", "a", "b");
		late.assertValues("a", "b");
	}

	@Test
	void withoutSeedNothingIsReplayedUntilFirstValue() {
		BehaviorSubject<Integer> subject = BehaviorSubject.create();
		AssertObserver<Integer> observer = new AssertObserver<>();

		assertThat(subject.hasValue()).isFalse();
		subject.subscribe(observer);
		observer.assertNoValues();

		subject.onNext(1);
		assertThat(subject.getValue()).isEqualTo(1);
	}

	@Test
	void lateSubscriberAfterCompletionOnlyGetsTerminal() {
		BehaviorSubject<String> subject = BehaviorSubject.create("x");
		subject.onNext("a");
		subject.onComplete();
		AssertObserver<String> late = new AssertObserver<>();

		subject.subscribe(late);

		late.assertNoValues().assertComplete();
		assertThat(subject.getValue()).isNull();
	}

	@Test
	void getValueTracksLatest() {
		BehaviorSubject<String> subject = BehaviorSubject.create("seed");

		assertThat(subject.getValue()).isEqualTo("seed");
		subject.onNext("next");
		assertThat(subject.getValue()).isEqualTo("next");
	}
}
