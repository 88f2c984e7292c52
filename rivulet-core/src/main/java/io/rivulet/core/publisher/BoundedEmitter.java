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

import io.rivulet.core.TerminalGuard;
import org.jspecify.annotations.Nullable;

/**
 * Adapts a stream {@link Emitter} to the single-outcome emitters. A value is expressed
 * as {@code onNext} immediately followed by {@code onComplete}. The first outcome wins
 * through its own {@link TerminalGuard}, later ones are contract violations. Only a
 * {@link Maybe} accepts a null value, as a completion without value.
 *
 * @param <T> the value type
 */
final class BoundedEmitter<T> implements SingleEmitter<T>, MaybeEmitter<T>, CompletableEmitter {

	final Emitter<T>    actual;
	final String        kind;
	final boolean       allowEmpty;
	final TerminalGuard produced = new TerminalGuard();

	BoundedEmitter(Emitter<T> actual, String kind, boolean allowEmpty) {
		this.actual = actual;
		this.kind = kind;
		this.allowEmpty = allowEmpty;
	}

	@Override
	public void success(@Nullable T value) {
		if (value == null) {
			if (allowEmpty) {
				complete();
			}
			else {
				error(new NullPointerException(kind + " success value must not be null"));
			}
			return;
		}
		if (!produced.stop()) {
			Operators.onContractViolation(kind + " already produced its outcome, success(" + value + ") ignored", value);
			return;
		}
		actual.onNext(value);
		actual.onComplete();
	}

	@Override
	public void complete() {
		if (!produced.stop()) {
			Operators.onContractViolation(kind + " already produced its outcome, complete() ignored");
			return;
		}
		actual.onComplete();
	}

	@Override
	public void error(Throwable e) {
		Objects.requireNonNull(e, "error");
		if (!produced.stop()) {
			Operators.onContractViolation(kind + " already produced its outcome, error(" + e + ") ignored");
			return;
		}
		actual.onError(e);
	}

	@Override
	public boolean isDisposed() {
		return produced.isStopped() || actual.isDisposed();
	}

	@Override
	public String toString() {
		return kind + "Emitter{" + produced + "}";
	}
}
