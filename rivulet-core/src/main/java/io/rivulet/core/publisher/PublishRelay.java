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

/**
 * A {@link Relay} backed by a {@link PublishSubject}: subscribers only receive the
 * values accepted after they attached.
 *
 * @param <T> the value type
 */
public final class PublishRelay<T> extends Relay<T> {

	/**
	 * @param <T> the value type
	 * @return a new {@link PublishRelay}
	 */
	public static <T> PublishRelay<T> create() {
		return new PublishRelay<>();
	}

	PublishRelay() {
		super(PublishSubject.create());
	}
}
