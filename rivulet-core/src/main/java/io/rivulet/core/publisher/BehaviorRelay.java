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

import org.jspecify.annotations.Nullable;

/**
 * A {@link Relay} backed by a {@link BehaviorSubject}: new subscribers first receive the
 * latest accepted value, or the seed.
 *
 * @param <T> the value type
 */
public final class BehaviorRelay<T> extends Relay<T> {

	/**
	 * @param <T> the value type
	 * @return a new {@link BehaviorRelay} without initial value
	 */
	public static <T> BehaviorRelay<T> create() {
		return new BehaviorRelay<>(BehaviorSubject.create());
	}

	/**
	 * @param seed the initial value
	 * @param <T> the value type
	 * @return a new {@link BehaviorRelay} replaying {@code seed} until a value is accepted
	 */
	public static <T> BehaviorRelay<T> create(T seed) {
		return new BehaviorRelay<>(BehaviorSubject.create(seed));
	}

	final BehaviorSubject<T> behavior;

	BehaviorRelay(BehaviorSubject<T> behavior) {
		super(behavior);
		this.behavior = behavior;
	}

	/**
	 * @return the latest accepted value or the seed, null if there is none
	 */
	public @Nullable T getValue() {
		return behavior.getValue();
	}
}
