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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@link Subject} that buffers the values it emits, up to a given size or without
 * limit, and replays them to each new subscriber. Subscribers arriving after the
 * termination receive the buffered values followed by the terminal signal.
 *
 * @param <T> the value type
 */
public final class ReplaySubject<T> extends Subject<T> {

	/**
	 * Create a {@link ReplaySubject} that replays at most the last {@code size} values.
	 *
	 * @param size the maximum number of values to replay, strictly positive
	 * @param <T> the value type
	 * @return a new {@link ReplaySubject}
	 */
	public static <T> ReplaySubject<T> createWithSize(int size) {
		if (size <= 0) {
			throw new IllegalArgumentException("size > 0 required but it was " + size);
		}
		return new ReplaySubject<>(size);
	}

	/**
	 * Create a {@link ReplaySubject} that replays every value it ever emitted.
	 *
	 * @param <T> the value type
	 * @return a new {@link ReplaySubject}
	 */
	public static <T> ReplaySubject<T> createUnbounded() {
		return new ReplaySubject<>(Integer.MAX_VALUE);
	}

	final int limit;

	//guarded by this
	final ArrayDeque<T> buffer = new ArrayDeque<>();

	ReplaySubject(int limit) {
		this.limit = limit;
	}

	@Override
	void record(T value) {
		if (buffer.size() == limit) {
			buffer.pollFirst();
		}
		buffer.addLast(value);
	}

	@Override
	void replay(SubjectInner<T> inner) {
		for (T v : buffer) {
			inner.enqueue(Signal.next(v));
		}
	}

	/**
	 * @return a copy of the values a new subscriber would currently receive
	 */
	public List<T> getValues() {
		synchronized (this) {
			return new ArrayList<>(buffer);
		}
	}
}
