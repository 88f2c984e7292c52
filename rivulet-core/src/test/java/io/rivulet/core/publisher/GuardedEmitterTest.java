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

import io.rivulet.core.Exceptions;
import io.rivulet.test.AssertObserver;
import io.rivulet.test.FakeDisposable;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class GuardedEmitterTest {

	@Test
	void forwardsWhileOpen() {
		AssertObserver<String> observer = new AssertObserver<>();
		GuardedEmitter<String> emitter = new GuardedEmitter<>(observer);

		emitter.onNext("a");
		emitter.on(Signal.next("b"));
		emitter.onComplete();

		observer.assertValues("a", "b").assertComplete();
		assertThat(emitter.isDisposed()).isTrue();
	}

	@Test
	void disposeIsSilent() {
		@SuppressWarnings("unchecked")
		Observer<String> observer = mock(Observer.class);
		FakeDisposable resource = new FakeDisposable();
		GuardedEmitter<String> emitter = new GuardedEmitter<>(observer);
		emitter.setResource(resource);

		emitter.dispose();
		emitter.onComplete();
		emitter.onError(new IllegalStateException("ignored"));

		verify(observer, never()).onComplete();
		verify(observer, never()).onError(any());
		assertThat(resource.disposeCount()).isEqualTo(1);
	}

	@Test
	void lateResourceIsDisposedImmediately() {
		GuardedEmitter<String> emitter = new GuardedEmitter<>(new AssertObserver<>());
		emitter.onComplete();

		FakeDisposable late = new FakeDisposable();
		emitter.setResource(late);

		assertThat(late.disposeCount()).isEqualTo(1);
	}

	@Test
	void nullResourceMeansNothingToRelease() {
		GuardedEmitter<String> emitter = new GuardedEmitter<>(new AssertObserver<>());

		emitter.setResource(null);
		emitter.dispose();

		assertThat(emitter.isDisposed()).isTrue();
	}

	@Test
	void losingErrorGoesToHook() {
		List<Throwable> dropped = new ArrayList<>();
		Hooks.onErrorDropped(dropped::add);
		GuardedEmitter<String> emitter = new GuardedEmitter<>(new AssertObserver<>());
		IllegalStateException late = new IllegalStateException("late");

		emitter.onComplete();
		emitter.onError(late);

		assertThat(dropped).containsExactly(late);
	}

	@Test
	void nullValueIsRejected() {
		GuardedEmitter<String> emitter = new GuardedEmitter<>(new AssertObserver<>());

		assertThatExceptionOfType(NullPointerException.class)
				.isThrownBy(() -> emitter.onNext(null));
	}

	@Test
	void failModeThrowsBackToProducer() {
		Hooks.onNextDroppedFail();
		GuardedEmitter<String> emitter = new GuardedEmitter<>(new AssertObserver<>());
		emitter.onComplete();

		assertThatExceptionOfType(IllegalStateException.class)
				.isThrownBy(() -> emitter.onNext("late"))
				.matches(Exceptions::isContractViolation);
	}

	@Test
	void failingErrorCallbackIsReportedWithOriginalError() {
		List<Throwable> dropped = new ArrayList<>();
		Hooks.onErrorDropped(dropped::add);
		IllegalStateException original = new IllegalStateException("original");
		IllegalArgumentException callbackFailure = new IllegalArgumentException("callback");
		GuardedEmitter<String> emitter = new GuardedEmitter<>(Observer.of(null, e -> {
			throw callbackFailure;
		}, null));

		emitter.onError(original);

		assertThat(dropped).hasSize(1);
		assertThat(Exceptions.unwrapMultiple(dropped.get(0))).containsExactly(original, callbackFailure);
	}

	@Test
	void failingCompleteCallbackIsReported() {
		List<Throwable> dropped = new ArrayList<>();
		Hooks.onErrorDropped(dropped::add);
		IllegalStateException failure = new IllegalStateException("complete callback");
		GuardedEmitter<String> emitter = new GuardedEmitter<>(Observer.of(null, null, () -> {
			throw failure;
		}));

		emitter.onComplete();

		assertThat(dropped).containsExactly(failure);
	}

	@Test
	void plainObserverThrowingOnErrorDoesNotReachProducer() {
		List<Throwable> dropped = new ArrayList<>();
		Hooks.onErrorDropped(dropped::add);
		IllegalStateException original = new IllegalStateException("original");
		IllegalArgumentException observerFailure = new IllegalArgumentException("observer");
		FakeDisposable resource = new FakeDisposable();
		GuardedEmitter<String> emitter = new GuardedEmitter<>(signal -> {
			throw observerFailure;
		});
		emitter.setResource(resource);

		emitter.onError(original);

		assertThat(dropped).singleElement()
		                   .satisfies(e -> assertThat(Exceptions.unwrapMultiple(e))
				                   .containsExactly(original, observerFailure));
		assertThat(resource.disposeCount()).isEqualTo(1);
	}

	@Test
	void plainObserverThrowingOnCompleteDoesNotReachProducer() {
		List<Throwable> dropped = new ArrayList<>();
		Hooks.onErrorDropped(dropped::add);
		IllegalStateException observerFailure = new IllegalStateException("observer");
		FakeDisposable resource = new FakeDisposable();
		GuardedEmitter<String> emitter = new GuardedEmitter<>(signal -> {
			throw observerFailure;
		});
		emitter.setResource(resource);

		emitter.onComplete();

		assertThat(dropped).containsExactly(observerFailure);
		assertThat(resource.disposeCount()).isEqualTo(1);
	}
}
