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

import org.jspecify.annotations.Nullable;

/**
 * The common implementation of a {@link Signal}.
 *
 * @param <T> the value type
 */
final class ImmutableSignal<T> implements Signal<T> {

	@SuppressWarnings("rawtypes")
	static final Signal ON_COMPLETE = new ImmutableSignal<>(SignalType.ON_COMPLETE, null, null);

	final SignalType type;

	final @Nullable T value;

	final @Nullable Throwable throwable;

	ImmutableSignal(SignalType type, @Nullable T value, @Nullable Throwable e) {
		this.type = type;
		this.value = value;
		this.throwable = e;
	}

	@SuppressWarnings("unchecked")
	static <U> Signal<U> onComplete() {
		return (Signal<U>) ON_COMPLETE;
	}

	@Override
	@Nullable
	public Throwable getThrowable() {
		return throwable;
	}

	@Override
	@Nullable
	public T get() {
		return value;
	}

	@Override
	public SignalType getType() {
		return type;
	}

	@Override
	public boolean equals(@Nullable Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Signal)) {
			return false;
		}
		Signal<?> signal = (Signal<?>) o;
		return type == signal.getType()
				&& Objects.equals(value, signal.get())
				&& Objects.equals(throwable, signal.getThrowable());
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value, throwable);
	}

	@Override
	public String toString() {
		switch (type) {
			case ON_NEXT:
				return "onNext(" + value + ")";
			case ON_ERROR:
				return "onError(" + throwable + ")";
			default:
				return "onComplete()";
		}
	}
}
