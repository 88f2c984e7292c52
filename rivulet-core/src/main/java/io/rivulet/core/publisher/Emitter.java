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
 * The emission capability handed to the activation function of an
 * {@link EventStream#create(java.util.function.Function) EventStream}: push values with
 * {@link #onNext(Object)} and terminate with {@link #onError(Throwable)} or
 * {@link #onComplete()}.
 * <p>
 * Terminal calls are thread-safe: when several threads race to terminate, exactly one
 * terminal signal reaches the subscriber and the others are reported as dropped.
 * {@link #onNext(Object)} calls are expected to be made serially by the producer.
 * Anything emitted after termination or disposal is dropped.
 *
 * @param <T> the value type
 */
public interface Emitter<T> extends Observer<T> {

	/**
	 * @return true if the subscription was disposed or terminated, in which case any
	 * further emission is dropped. Producers can poll this to stop early.
	 */
	boolean isDisposed();
}
