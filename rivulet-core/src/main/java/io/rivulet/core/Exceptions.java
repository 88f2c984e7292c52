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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

import org.jspecify.annotations.Nullable;

/**
 * Global Rivulet exception handling and utils to operate on.
 */
public abstract class Exceptions {

	/**
	 * Create a composite exception that wraps the given {@link Throwable Throwable(s)},
	 * as suppressed exceptions. Instances created by this method can be detected using the
	 * {@link #isMultiple(Throwable)} check. The {@link #unwrapMultiple(Throwable)} method
	 * will correctly unwrap these to a {@link List} of the suppressed exceptions.
	 *
	 * @param throwables the exceptions to wrap into a composite
	 * @return a composite exception with a standard message, and the given throwables as
	 * suppressed exceptions
	 */
	public static RuntimeException multiple(Throwable... throwables) {
		return multiple(Arrays.asList(throwables));
	}

	/**
	 * Create a composite exception that wraps the given {@link Throwable Throwable(s)},
	 * as suppressed exceptions.
	 *
	 * @param throwables the exceptions to wrap into a composite
	 * @return a composite exception with a standard message, and the given throwables as
	 * suppressed exceptions
	 * @see #multiple(Throwable...)
	 */
	public static RuntimeException multiple(Iterable<Throwable> throwables) {
		CompositeException multiple = new CompositeException();
		for (Throwable t : throwables) {
			//this is ok, multiple is always a new non-singleton instance
			multiple.addSuppressed(t);
		}
		return multiple;
	}

	/**
	 * Return an {@link UnsupportedOperationException} indicating that the error callback
	 * on a subscriber was not implemented, yet an error was propagated.
	 *
	 * @param cause original error not processed by a receiver.
	 * @return an {@link UnsupportedOperationException} indicating the error callback was
	 * not implemented and holding the original propagated error.
	 * @see #isErrorCallbackNotImplemented(Throwable)
	 */
	public static UnsupportedOperationException errorCallbackNotImplemented(Throwable cause) {
		Objects.requireNonNull(cause, "cause");
		return new ErrorCallbackNotImplemented(cause);
	}

	/**
	 * Return an {@link IllegalStateException} signalling that a producer broke the
	 * cardinality contract of the stream it feeds (eg. a second value for a single-value
	 * stream, or a terminal signal fed to a relay). Such errors are never delivered to the
	 * subscriber as a second terminal signal, they are reported for diagnostics.
	 *
	 * @param message the description of the violation
	 * @return an {@link IllegalStateException} detectable via {@link #isContractViolation(Throwable)}
	 */
	public static IllegalStateException failWithContractViolation(String message) {
		return new ContractViolationException(message);
	}

	/**
	 * Return an {@link IllegalStateException} indicating a value couldn't be emitted due
	 * to a lack of request.
	 *
	 * @param message the exception's message
	 * @return an {@link IllegalStateException}
	 * @see #isOverflow(Throwable)
	 */
	public static IllegalStateException failWithOverflow(String message) {
		return new OverflowException(message);
	}

	/**
	 * Return a new {@link RejectedExecutionException} with standard message and cause,
	 * unless the {@code cause} is already a rejection created by this method.
	 *
	 * @param cause the original exception that caused the rejection
	 * @return a new {@link RejectedExecutionException} with standard message and cause
	 */
	public static RejectedExecutionException failWithRejected(Throwable cause) {
		if (cause instanceof SchedulerRejectedException) {
			return (RejectedExecutionException) cause;
		}
		return new SchedulerRejectedException("Scheduler unavailable", cause);
	}

	/**
	 * @param message the rejection reason
	 * @return a new {@link RejectedExecutionException} with the given message
	 */
	public static RejectedExecutionException failWithRejected(String message) {
		return new SchedulerRejectedException(message, null);
	}

	/**
	 * @param elements the invalid requested demand
	 *
	 * @return a new {@link IllegalArgumentException} with a cause message abiding to
	 * Reactive Streams rule 3.9.
	 */
	public static IllegalArgumentException nullOrNegativeRequestException(long elements) {
		return new IllegalArgumentException(
				"Reactive Streams rule 3.9 - Cannot request a non strictly positive number: " + elements);
	}

	/**
	 * @param t the {@link Throwable} error to check
	 * @return true if given {@link Throwable} is a contract violation.
	 */
	public static boolean isContractViolation(@Nullable Throwable t) {
		return t instanceof ContractViolationException;
	}

	/**
	 * @param t the {@link Throwable} error to check
	 * @return true if the given {@link Throwable} represents an overflow.
	 */
	public static boolean isOverflow(@Nullable Throwable t) {
		return t instanceof OverflowException;
	}

	/**
	 * Check if the given error is a {@link #errorCallbackNotImplemented(Throwable) callback not implemented}
	 * exception, in which case its {@link Throwable#getCause() cause} will be the propagated
	 * error that couldn't be processed.
	 *
	 * @param t the {@link Throwable} error to check
	 * @return true if given {@link Throwable} is a callback not implemented exception.
	 */
	public static boolean isErrorCallbackNotImplemented(@Nullable Throwable t) {
		return t instanceof ErrorCallbackNotImplemented;
	}

	/**
	 * @param t the {@link Throwable} to check, {@literal null} always yields {@literal false}
	 * @return true if the Throwable is an instance created by {@link #multiple(Throwable...)}
	 */
	public static boolean isMultiple(@Nullable Throwable t) {
		return t instanceof CompositeException;
	}

	/**
	 * Prepare an unchecked {@link RuntimeException} that can be thrown to propagate the
	 * given error. <p>This method invokes {@link #throwIfFatal(Throwable)}.
	 *
	 * @param t the root cause
	 * @return an unchecked exception
	 */
	public static RuntimeException propagate(Throwable t) {
		throwIfFatal(t);
		if (t instanceof RuntimeException) {
			return (RuntimeException) t;
		}
		return new ReactiveException(t);
	}

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error
	 * varieties: {@link VirtualMachineError}, {@link ThreadDeath} and {@link LinkageError}.
	 *
	 * @param t the exception to evaluate
	 */
	public static void throwIfFatal(@Nullable Throwable t) {
		throwIfJvmFatal(t);
	}

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error
	 * varieties native to the JVM.
	 *
	 * @param t the exception to evaluate
	 */
	@SuppressWarnings("deprecation")
	public static void throwIfJvmFatal(@Nullable Throwable t) {
		if (t instanceof VirtualMachineError) {
			throw (VirtualMachineError) t;
		}
		if (t instanceof ThreadDeath) {
			throw (ThreadDeath) t;
		}
		if (t instanceof LinkageError) {
			throw (LinkageError) t;
		}
	}

	/**
	 * Unwrap a particular {@code Throwable} only if it was wrapped via
	 * {@link #propagate(Throwable) propagate}.
	 *
	 * @param t the exception to unwrap
	 * @return the unwrapped exception or current one if not wrapped
	 */
	public static Throwable unwrap(Throwable t) {
		Throwable _t = t;
		while (_t instanceof ReactiveException && !(_t instanceof CompositeException)) {
			Throwable cause = _t.getCause();
			if (cause == null) {
				break;
			}
			_t = cause;
		}
		return _t;
	}

	/**
	 * Attempt to unwrap a {@link Throwable} into a {@link List} of Throwables. This is
	 * only done on the condition that said Throwable is a composite exception built by
	 * {@link #multiple(Throwable...)}, in which case the list contains the exceptions
	 * wrapped as suppressed exceptions in the composite. In any other case, the list only
	 * contains the input Throwable (or is empty in case of null input).
	 *
	 * @param potentialMultiple the {@link Throwable} to unwrap if multiple
	 * @return a {@link List} of the exceptions suppressed by the {@link Throwable} if
	 * multiple, or a List containing the Throwable otherwise. Null input results in an
	 * empty List.
	 */
	public static List<Throwable> unwrapMultiple(@Nullable Throwable potentialMultiple) {
		if (potentialMultiple == null) {
			return Collections.emptyList();
		}

		if (isMultiple(potentialMultiple)) {
			return new ArrayList<>(Arrays.asList(potentialMultiple.getSuppressed()));
		}

		return Collections.singletonList(potentialMultiple);
	}

	Exceptions() {
	}

	static class ReactiveException extends RuntimeException {

		ReactiveException(Throwable cause) {
			super(cause);
		}

		ReactiveException(String message) {
			super(message);
		}

		@Override
		public synchronized Throwable fillInStackTrace() {
			return getCause() != null ? getCause().fillInStackTrace() :
					super.fillInStackTrace();
		}

		private static final long serialVersionUID = 2491425227432776143L;
	}

	static final class CompositeException extends ReactiveException {

		CompositeException() {
			super("Multiple exceptions");
		}

		private static final long serialVersionUID = 8070744939537687606L;
	}

	static final class ErrorCallbackNotImplemented extends UnsupportedOperationException {

		ErrorCallbackNotImplemented(Throwable cause) {
			super(cause);
		}

		@Override
		public synchronized Throwable fillInStackTrace() {
			return this;
		}

		private static final long serialVersionUID = 2491425227432776143L;
	}

	static final class ContractViolationException extends IllegalStateException {

		ContractViolationException(String message) {
			super(message);
		}

		private static final long serialVersionUID = -2268354981873449915L;
	}

	static final class SchedulerRejectedException extends RejectedExecutionException {

		SchedulerRejectedException(String message, @Nullable Throwable cause) {
			super(message, cause);
		}

		private static final long serialVersionUID = 2491425227432776144L;
	}

	static final class OverflowException extends IllegalStateException {

		OverflowException(String s) {
			super(s);
		}

		private static final long serialVersionUID = 6235189417826513049L;
	}
}
