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
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import io.rivulet.core.Disposable;
import io.rivulet.core.Disposables;
import io.rivulet.core.Exceptions;
import io.rivulet.core.TerminalGuard;
import org.jspecify.annotations.Nullable;

/**
 * The adapter standing between a producer and one subscriber: it forwards values while
 * the subscription is open, lets exactly one terminal signal through, and owns the
 * resource returned by the activation.
 * <p>
 * Once terminated or disposed, values are reported to {@link Operators#onNextDropped}
 * and losing terminal signals to {@link Operators#onErrorDropped}. A resource handed
 * over after the subscription closed is disposed immediately.
 *
 * @param <T> the value type
 */
final class GuardedEmitter<T> implements Emitter<T>, Disposable {

	final Observer<? super T> actual;

	final TerminalGuard guard = new TerminalGuard();

	volatile @Nullable Disposable resource;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<GuardedEmitter, Disposable> RESOURCE =
			AtomicReferenceFieldUpdater.newUpdater(GuardedEmitter.class, Disposable.class, "resource");

	GuardedEmitter(Observer<? super T> actual) {
		this.actual = Objects.requireNonNull(actual, "actual");
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
		Objects.requireNonNull(t, "onNext");
		if (!guard.isOpen()) {
			Operators.onNextDropped(t);
			return;
		}
		try {
			actual.onNext(t);
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			onError(e);
		}
	}

	@Override
	public void onError(Throwable e) {
		Objects.requireNonNull(e, "onError");
		if (!guard.stop()) {
			Operators.onErrorDropped(e);
			return;
		}
		try {
			actual.onError(e);
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			Operators.onErrorDropped(Exceptions.multiple(e, t));
		}
		finally {
			Disposables.dispose(RESOURCE, this);
		}
	}

	@Override
	public void onComplete() {
		if (!guard.stop()) {
			Operators.onCompleteDropped();
			return;
		}
		try {
			actual.onComplete();
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			//already terminated, nowhere to deliver this
			Operators.onErrorDropped(t);
		}
		finally {
			Disposables.dispose(RESOURCE, this);
		}
	}

	/**
	 * Attach the activation's resource. If the subscription is already closed the
	 * resource is disposed right away.
	 *
	 * @param d the resource, null meaning there is nothing to release
	 */
	void setResource(@Nullable Disposable d) {
		Disposables.replace(RESOURCE, this, d);
	}

	@Override
	public void dispose() {
		guard.stop();
		Disposables.dispose(RESOURCE, this);
	}

	@Override
	public boolean isDisposed() {
		return guard.isStopped();
	}

	@Override
	public String toString() {
		return "GuardedEmitter{" + actual + ", " + guard + "}";
	}
}
