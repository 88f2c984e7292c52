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
 * Produces the outcome of a {@link Completable}: exactly one of {@link #complete()} or
 * {@link #error(Throwable)}. Any call after the first is a contract violation, reported
 * to {@link Hooks#onErrorDropped(java.util.function.Consumer)} and otherwise ignored.
 */
public interface CompletableEmitter {

	/**
	 * Complete successfully.
	 */
	void complete();

	/**
	 * Fail with the given error.
	 *
	 * @param e the error
	 */
	void error(Throwable e);

	/**
	 * @return true if the subscriber is gone or the outcome was already produced
	 */
	boolean isDisposed();
}
