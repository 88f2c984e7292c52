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

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import io.rivulet.core.Disposable;
import io.rivulet.core.Exceptions;
import io.rivulet.core.TerminalGuard;
import org.jspecify.annotations.Nullable;

/**
 * One subscriber of a {@link Subject}. Signals are queued by the subject and delivered
 * by whichever thread wins the work-in-progress counter, so deliveries to this
 * subscriber never overlap.
 * <p>
 * The subject only enqueues to entries still attached when it takes its snapshot, so
 * everything found in the queue is delivered even if the entry is disposed in the
 * meantime. Disposal stops further enqueuing, not the delivery of signals already
 * snapshotted.
 *
 * @param <T> the value type
 */
final class SubjectInner<T> implements Disposable {

	final Observer<? super T> actual;
	final Subject<T>          parent;
	final long                id;
	final Queue<Signal<T>>    queue = new ConcurrentLinkedQueue<>();

	/** Stopped once a terminal signal was handed to {@link #actual}. */
	final TerminalGuard done     = new TerminalGuard();
	/** Stopped by {@link #dispose()}. */
	final TerminalGuard detached = new TerminalGuard();

	volatile int wip;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<SubjectInner> WIP =
			AtomicIntegerFieldUpdater.newUpdater(SubjectInner.class, "wip");

	SubjectInner(Observer<? super T> actual, Subject<T> parent, long id) {
		this.actual = actual;
		this.parent = parent;
		this.id = id;
	}

	void enqueue(Signal<T> signal) {
		queue.offer(signal);
	}

	/**
	 * Deliver the queued signals. A failure escaping a delivery (a throwing drop hook)
	 * does not stop the loop: it is rethrown once the queue is empty and the
	 * work-in-progress counter released.
	 */
	void drain() {
		if (WIP.getAndIncrement(this) != 0) {
			return;
		}
		@Nullable Throwable failure = null;
		int missed = 1;
		for (;;) {
			Signal<T> signal;
			while ((signal = queue.poll()) != null) {
				try {
					deliver(signal);
				}
				catch (Throwable e) {
					Exceptions.throwIfFatal(e);
					failure = Subject.addFailure(failure, e);
				}
			}
			missed = WIP.addAndGet(this, -missed);
			if (missed == 0) {
				break;
			}
		}
		if (failure != null) {
			throw Exceptions.propagate(failure);
		}
	}

	void deliver(Signal<T> signal) {
		switch (signal.getType()) {
			case ON_NEXT: {
				T value = signal.get();
				if (value == null) {
					return;
				}
				if (done.isStopped()) {
					Operators.onNextDropped(value);
					return;
				}
				try {
					actual.onNext(value);
				}
				catch (Throwable e) {
					Exceptions.throwIfFatal(e);
					parent.remove(this);
					deliverError(e);
				}
				return;
			}
			case ON_ERROR: {
				Throwable e = signal.getThrowable();
				if (e != null) {
					deliverError(e);
				}
				return;
			}
			default:
				if (!done.stop()) {
					Operators.onCompleteDropped();
					return;
				}
				try {
					actual.onComplete();
				}
				catch (Throwable e) {
					Exceptions.throwIfFatal(e);
					Operators.onErrorDropped(e);
				}
		}
	}

	void deliverError(Throwable e) {
		if (!done.stop()) {
			Operators.onErrorDropped(e);
			return;
		}
		try {
			actual.onError(e);
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			Operators.onErrorDropped(Exceptions.multiple(e, t));
		}
	}

	@Override
	public void dispose() {
		if (detached.stop()) {
			parent.remove(this);
		}
	}

	@Override
	public boolean isDisposed() {
		return detached.isStopped() || done.isStopped();
	}

	@Override
	public String toString() {
		return "SubjectInner{id=" + id + ", done=" + done + ", detached=" + detached + "}";
	}
}
