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
import java.util.function.Function;

import io.rivulet.core.Disposable;
import io.rivulet.core.Disposables;
import io.rivulet.core.Exceptions;
import org.jspecify.annotations.Nullable;

/**
 * Runs the activation function once per subscriber, handing it a fresh
 * {@link GuardedEmitter}.
 *
 * @param <T> the value type
 */
final class EventStreamCreate<T> extends EventStream<T> {

	final Function<? super Emitter<T>, ? extends @Nullable Disposable> activation;

	EventStreamCreate(Function<? super Emitter<T>, ? extends @Nullable Disposable> activation) {
		this.activation = Objects.requireNonNull(activation, "activation");
	}

	@Override
	public Disposable subscribe(Observer<? super T> actual) {
		GuardedEmitter<T> emitter = new GuardedEmitter<>(actual);
		Disposable resource;
		try {
			resource = activation.apply(emitter);
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			emitter.onError(e);
			return Disposables.disposed();
		}
		emitter.setResource(resource);
		return emitter;
	}

	@Override
	public String toString() {
		return "EventStreamCreate";
	}
}
