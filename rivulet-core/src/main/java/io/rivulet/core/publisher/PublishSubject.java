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
 * A {@link Subject} that replays nothing: a subscriber only receives the signals
 * emitted after it attached.
 * <pre><code>
 * PublishSubject&lt;String&gt; subject = PublishSubject.create();
 * subject.onNext("a");               // nobody attached, lost
 * subject.subscribe(observer);
 * subject.onNext("b");               // observer receives "b"
 * </code></pre>
 *
 * @param <T> the value type
 */
public final class PublishSubject<T> extends Subject<T> {

	/**
	 * Create a new {@link PublishSubject}.
	 *
	 * @param <T> the value type
	 * @return a new {@link PublishSubject}
	 */
	public static <T> PublishSubject<T> create() {
		return new PublishSubject<>();
	}

	PublishSubject() {
	}
}
