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

import io.rivulet.core.Disposable;

/**
 * A hot {@link EventStream} that only accepts values: it cannot be terminated, so its
 * subscribers only ever end by disposal.
 *
 * @param <T> the value type
 *
 * @see PublishRelay
 * @see BehaviorRelay
 */
public abstract class Relay<T> extends EventStream<T> implements Consumer<T> {

	final Subject<T> subject;

	Relay(Subject<T> subject) {
		this.subject = subject;
	}

	/**
	 * Multicast a value to the current subscribers.
	 *
	 * @param value the value, not null
	 */
	@Override
	public void accept(T value) {
		subject.onNext(Objects.requireNonNull(value, "value"));
	}

	@Override
	public Disposable subscribe(Observer<? super T> observer) {
		return subject.subscribe(observer);
	}

	/**
	 * Expose this relay as an {@link Observer}, for instance to subscribe it to another
	 * {@link EventStream}. Values are accepted, terminal signals are reported as
	 * contract violations and otherwise ignored.
	 *
	 * @return an {@link Observer} feeding this relay
	 */
	public Observer<T> asObserver() {
		return signal -> {
			switch (signal.getType()) {
				case ON_NEXT:
					accept(Objects.requireNonNull(signal.get(), "value"));
					break;
				case ON_ERROR:
					Operators.onContractViolation(this + " cannot be terminated, onError("
							+ signal.getThrowable() + ") ignored");
					break;
				default:
					Operators.onContractViolation(this + " cannot be terminated, onComplete() ignored");
			}
		};
	}

	/**
	 * @return true if at least one subscriber is attached
	 */
	public final boolean hasObservers() {
		return subject.hasObservers();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
