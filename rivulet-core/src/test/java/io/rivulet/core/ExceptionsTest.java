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

package io.rivulet.core;

import java.io.IOException;
import java.util.concurrent.RejectedExecutionException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class ExceptionsTest {

	@Test
	void multipleKeepsErrorsAsSuppressed() {
		IllegalStateException e1 = new IllegalStateException("one");
		IllegalArgumentException e2 = new IllegalArgumentException("two");

		RuntimeException multiple = Exceptions.multiple(e1, e2);

		assertThat(Exceptions.isMultiple(multiple)).isTrue();
		assertThat(multiple).hasMessage("Multiple exceptions");
		assertThat(Exceptions.unwrapMultiple(multiple)).containsExactly(e1, e2);
	}

	@Test
	void unwrapMultipleOfSimpleError() {
		IllegalStateException e = new IllegalStateException("one");

		assertThat(Exceptions.unwrapMultiple(e)).containsExactly(e);
		assertThat(Exceptions.unwrapMultiple(null)).isEmpty();
	}

	@Test
	void propagateWrapsCheckedAndUnwraps() {
		IOException checked = new IOException("io");

		RuntimeException propagated = Exceptions.propagate(checked);

		assertThat(propagated).hasCause(checked);
		assertThat(Exceptions.unwrap(propagated)).isSameAs(checked);
	}

	@Test
	void propagateKeepsRuntimeException() {
		IllegalStateException e = new IllegalStateException("boom");

		assertThat(Exceptions.propagate(e)).isSameAs(e);
	}

	@Test
	void throwIfFatalRethrowsJvmErrors() {
		assertThatExceptionOfType(StackOverflowError.class)
				.isThrownBy(() -> Exceptions.throwIfFatal(new StackOverflowError()));
		assertThatExceptionOfType(NoClassDefFoundError.class)
				.isThrownBy(() -> Exceptions.throwIfFatal(new NoClassDefFoundError()));
		assertThatCode(() -> Exceptions.throwIfFatal(new IllegalStateException()))
				.doesNotThrowAnyException();
	}

	@Test
	void contractViolationIsAnIllegalStateException() {
		IllegalStateException e = Exceptions.failWithContractViolation("twice");

		assertThat(e).hasMessage("twice");
		assertThat(Exceptions.isContractViolation(e)).isTrue();
		assertThat(Exceptions.isContractViolation(new IllegalStateException("twice"))).isFalse();
	}

	@Test
	void overflowIsRecognized() {
		assertThat(Exceptions.isOverflow(Exceptions.failWithOverflow("too many"))).isTrue();
		assertThat(Exceptions.isOverflow(new IllegalStateException())).isFalse();
	}

	@Test
	void errorCallbackNotImplementedWrapsCause() {
		IllegalStateException cause = new IllegalStateException("boom");

		UnsupportedOperationException e = Exceptions.errorCallbackNotImplemented(cause);

		assertThat(Exceptions.isErrorCallbackNotImplemented(e)).isTrue();
		assertThat(e).hasCause(cause);
	}

	@Test
	void rejectedIsNotWrappedTwice() {
		IllegalStateException cause = new IllegalStateException("shutdown");

		RejectedExecutionException rejected = Exceptions.failWithRejected(cause);

		assertThat(rejected).hasCause(cause);
		assertThat(Exceptions.failWithRejected(rejected)).isSameAs(rejected);
	}

	@Test
	void badRequestMessage() {
		assertThat(Exceptions.nullOrNegativeRequestException(-1))
				.hasMessageContaining("rule 3.9")
				.hasMessageEndingWith("-1");
	}
}
