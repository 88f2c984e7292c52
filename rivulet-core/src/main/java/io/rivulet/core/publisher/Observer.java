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

import org.jspecify.annotations.Nullable;

/**
 * The receiving end of a subscription: a single handler over the closed set of
 * {@link Signal} varieties. Implementations only need to provide {@link #on(Signal)},
 * the {@code onXxx} methods are conveniences that build the matching {@link Signal}
 * (and may be overridden to avoid that allocation).
 * <p>
 * An {@link Observer} is invoked by whichever component it is subscribed to and must not
 * be expected to outlive that subscription. The guarantee it gets is that it sees zero or
 * more {@link SignalType#ON_NEXT} followed by at most one terminal signal.
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface Observer<T> {

	/**
	 * Create an {@link Observer} out of callbacks, any of which may be null. An error
	 * reaching an observer without error callback is reported to
	 * {@link Hooks#onErrorDropped(Consumer)}.
	 *
	 * @param onNext the value callback
	 * @param onError the error callback
	 * @param onComplete the completion callback
	 * @param <T> the value type
	 * @return a new {@link Observer} dispatching to the callbacks
	 */
	static <T> Observer<T> of(@Nullable Consumer<? super T> onNext,
			@Nullable Consumer<? super Throwable> onError,
			@Nullable Runnable onComplete) {
		return new LambdaObserver<>(onNext, onError, onComplete);
	}

	/**
	 * Handle one signal.
	 *
	 * @param signal the signal to handle
	 */
	void on(Signal<? extends T> signal);

	default void onNext(T t) {
		on(Signal.next(t));
	}

	default void onError(Throwable e) {
		on(Signal.error(e));
	}

	default void onComplete() {
		on(Signal.complete());
	}
}
