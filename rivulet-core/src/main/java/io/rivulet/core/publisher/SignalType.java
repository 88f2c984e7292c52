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
 * The three kinds of {@link Signal} an {@link Observer} can receive.
 */
public enum SignalType {

	/**
	 * A value.
	 */
	ON_NEXT,
	/**
	 * A failure, terminal.
	 */
	ON_ERROR,
	/**
	 * A successful completion, terminal.
	 */
	ON_COMPLETE;

	/**
	 * @return true for {@link #ON_ERROR} and {@link #ON_COMPLETE}
	 */
	public boolean isTerminal() {
		return this != ON_NEXT;
	}

	@Override
	public String toString() {
		switch (this) {
			case ON_NEXT:
				return "onNext";
			case ON_ERROR:
				return "onError";
			default:
				return "onComplete";
		}
	}
}
