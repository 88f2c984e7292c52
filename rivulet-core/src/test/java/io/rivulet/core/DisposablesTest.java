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

package io.rivulet.core;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import io.rivulet.test.FakeDisposable;
import io.rivulet.test.RaceTestUtils;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DisposablesTest {

	static final class Holder {

		volatile @Nullable Disposable resource;
		static final AtomicReferenceFieldUpdater<Holder, Disposable> RESOURCE =
				AtomicReferenceFieldUpdater.newUpdater(Holder.class, Disposable.class, "resource");
	}

	@Test
	void fromRunnableRunsOnce() {
		AtomicInteger count = new AtomicInteger();
		Disposable d = Disposables.fromRunnable(count::incrementAndGet);

		assertThat(d.isDisposed()).isFalse();

		d.dispose();
		d.dispose();

		assertThat(count).hasValue(1);
		assertThat(d.isDisposed()).isTrue();
	}

	@Test
	void fromRunnableRacingDisposeRunsOnce() {
		for (int i = 0; i < 500; i++) {
			AtomicInteger count = new AtomicInteger();
			Disposable d = Disposables.fromRunnable(count::incrementAndGet);

			RaceTestUtils.race(d::dispose, d::dispose, d::dispose);

			assertThat(count).as("round " + i).hasValue(1);
		}
	}

	@Test
	void compositeOfHandlesDisposesAll() {
		FakeDisposable a = new FakeDisposable();
		FakeDisposable b = new FakeDisposable();

		Disposable.Composite composite = Disposables.composite(a, b);
		composite.dispose();

		assertThat(a.disposeCount()).isEqualTo(1);
		assertThat(b.disposeCount()).isEqualTo(1);
	}

	@Test
	void compositeFromIterable() {
		FakeDisposable a = new FakeDisposable();
		FakeDisposable b = new FakeDisposable();

		Disposable.Composite composite = Disposables.composite(Arrays.asList(a, b));

		assertThat(composite.size()).isEqualTo(2);
	}

	@Test
	void disposeWithHandsOwnershipToTheBag() {
		Disposable.Composite bag = Disposables.composite();
		FakeDisposable d = new FakeDisposable();

		Disposable returned = d.disposeWith(bag);

		assertThat(returned).isSameAs(d);
		assertThat(bag.size()).isEqualTo(1);

		bag.dispose();
		assertThat(d.isDisposed()).isTrue();
	}

	@Test
	void singleCanBeDisposed() {
		Disposable d = Disposables.single();

		assertThat(d.isDisposed()).isFalse();
		d.dispose();
		assertThat(d.isDisposed()).isTrue();
	}

	@Test
	void neverAndDisposed() {
		Disposable never = Disposables.never();
		never.dispose();

		assertThat(never.isDisposed()).isFalse();
		assertThat(Disposables.disposed().isDisposed()).isTrue();
	}

	@Test
	void replaceAfterDisposeDisposesNewValue() {
		Holder holder = new Holder();
		FakeDisposable first = new FakeDisposable();
		FakeDisposable late = new FakeDisposable();

		assertThat(Disposables.replace(Holder.RESOURCE, holder, first)).isTrue();
		assertThat(Disposables.dispose(Holder.RESOURCE, holder)).isTrue();
		assertThat(first.disposeCount()).isEqualTo(1);

		assertThat(Disposables.replace(Holder.RESOURCE, holder, late)).isFalse();
		assertThat(late.disposeCount()).isEqualTo(1);
		assertThat(Disposables.isDisposed(holder.resource)).isTrue();
	}

	@Test
	void slotDisposeIsIdempotent() {
		Holder holder = new Holder();
		FakeDisposable d = new FakeDisposable();
		Disposables.replace(Holder.RESOURCE, holder, d);

		assertThat(Disposables.dispose(Holder.RESOURCE, holder)).isTrue();
		assertThat(Disposables.dispose(Holder.RESOURCE, holder)).isFalse();
		assertThat(d.disposeCount()).isEqualTo(1);
	}

	@Test
	void replaceDoesNotDisposePrevious() {
		Holder holder = new Holder();
		FakeDisposable first = new FakeDisposable();
		FakeDisposable second = new FakeDisposable();

		Disposables.replace(Holder.RESOURCE, holder, first);
		Disposables.replace(Holder.RESOURCE, holder, second);

		assertThat(first.isDisposed()).isFalse();
		assertThat(holder.resource).isSameAs(second);
	}
}
