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

import java.util.function.Consumer;

import io.rivulet.core.Exceptions;
import org.jspecify.annotations.Nullable;

/**
 * A Java Lambda adapter to {@link Observer}. Terminal guarding is left to the adapter
 * that invokes it.
 *
 * @param <T> the value type
 */
final class LambdaObserver<T> implements Observer<T> {

	final @Nullable Consumer<? super T>         consumer;
	final @Nullable Consumer<? super Throwable> errorConsumer;
	final @Nullable Runnable                    completeConsumer;

	/**
	 * Create an {@link Observer} reacting onNext, onError and onComplete.
	 *
	 * @param consumer A {@link Consumer} with argument onNext data
	 * @param errorConsumer A {@link Consumer} called onError
	 * @param completeConsumer A {@link Runnable} called onComplete
	 */
	LambdaObserver(@Nullable Consumer<? super T> consumer,
			@Nullable Consumer<? super Throwable> errorConsumer,
			@Nullable Runnable completeConsumer) {
		this.consumer = consumer;
		this.errorConsumer = errorConsumer;
		this.completeConsumer = completeConsumer;
	}

	@Override
	public void on(Signal<? extends T> signal) {
		switch (signal.getType()) {
			case ON_NEXT:
				T value = signal.get();
				if (value != null) {
					onNext(value);
				}
				break;
			case ON_ERROR:
				Throwable e = signal.getThrowable();
				if (e != null) {
					onError(e);
				}
				break;
			default:
				onComplete();
		}
	}

	@Override
	public void onNext(T x) {
		//a failing consumer is turned into an error by the calling adapter
		if (consumer != null) {
			consumer.accept(x);
		}
	}

	@Override
	public void onError(Throwable t) {
		if (errorConsumer == null) {
			Operators.onErrorDropped(Exceptions.errorCallbackNotImplemented(t));
			return;
		}
		try {
			errorConsumer.accept(t);
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			Operators.onErrorDropped(Exceptions.multiple(t, e));
		}
	}

	@Override
	public void onComplete() {
		if (completeConsumer != null) {
			try {
				completeConsumer.run();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				//the subscription is already terminated, nowhere to deliver this
				Operators.onErrorDropped(t);
			}
		}
	}
}
