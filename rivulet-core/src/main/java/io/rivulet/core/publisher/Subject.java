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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

import io.rivulet.core.Disposable;
import io.rivulet.core.Exceptions;
import io.rivulet.core.TerminalGuard;
import org.jspecify.annotations.Nullable;

/**
 * A hot {@link EventStream} that is also an {@link Observer}: every signal it receives
 * is multicast to the subscribers attached at that moment.
 * <p>
 * A subject moves once from active to terminated. Subscribers arriving after the
 * termination receive whatever the variant replays followed by the same terminal
 * signal, and are not retained. Emission takes a snapshot of the subscribers under a
 * lock and delivers outside of it, so a subscriber attaching or detaching during an
 * emission is only affected by the next one. Each subscriber receives its signals
 * serially, even when the subject is fed from several threads or reentrantly from a
 * subscriber callback.
 *
 * @param <T> the value type
 *
 * @see PublishSubject
 * @see BehaviorSubject
 * @see ReplaySubject
 */
public abstract class Subject<T> extends EventStream<T> implements Observer<T> {

	final TerminalGuard guard = new TerminalGuard();

	//guarded by this
	final LinkedHashMap<Long, SubjectInner<T>> subscribers = new LinkedHashMap<>();
	long                                       nextId;
	@Nullable Signal<T>                        terminal;

	Subject() {
	}

	@Override
	public Disposable subscribe(Observer<? super T> actual) {
		Objects.requireNonNull(actual, "subscribe");
		SubjectInner<T> inner;
		synchronized (this) {
			inner = new SubjectInner<>(actual, this, nextId++);
			replay(inner);
			Signal<T> t = terminal;
			if (t != null) {
				inner.enqueue(t);
			}
			else {
				subscribers.put(inner.id, inner);
			}
		}
		inner.drain();
		return inner;
	}

	@Override
	public void on(Signal<? extends T> signal) {
		switch (signal.getType()) {
			case ON_NEXT:
				onNext(Objects.requireNonNull(signal.get(), "value"));
				break;
			case ON_ERROR:
				onError(Objects.requireNonNull(signal.getThrowable(), "throwable"));
				break;
			default:
				onComplete();
		}
	}

	@Override
	public void onNext(T t) {
		Objects.requireNonNull(t, "onNext");
		if (guard.isStopped()) {
			Operators.onNextDropped(t);
			return;
		}
		Signal<T> signal = Signal.next(t);
		List<SubjectInner<T>> snapshot;
		boolean dropped;
		synchronized (this) {
			dropped = terminal != null;
			if (dropped) {
				snapshot = Collections.emptyList();
			}
			else {
				record(t);
				snapshot = snapshot(signal);
			}
		}
		if (dropped) {
			Operators.onNextDropped(t);
			return;
		}
		drain(snapshot);
	}

	@Override
	public void onError(Throwable e) {
		Objects.requireNonNull(e, "onError");
		if (!guard.stop()) {
			Operators.onErrorDropped(e);
			return;
		}
		terminate(Signal.error(e));
	}

	@Override
	public void onComplete() {
		if (!guard.stop()) {
			Operators.onCompleteDropped();
			return;
		}
		terminate(Signal.complete());
	}

	void terminate(Signal<T> signal) {
		List<SubjectInner<T>> snapshot;
		synchronized (this) {
			terminal = signal;
			snapshot = snapshot(signal);
			subscribers.clear();
		}
		drain(snapshot);
	}

	//must be called while holding the lock
	List<SubjectInner<T>> snapshot(Signal<T> signal) {
		if (subscribers.isEmpty()) {
			return new ArrayList<>(0);
		}
		List<SubjectInner<T>> snapshot = new ArrayList<>(subscribers.values());
		for (SubjectInner<T> inner : snapshot) {
			inner.enqueue(signal);
		}
		return snapshot;
	}

	//every entry is drained before a failure is rethrown
	static <T> void drain(List<SubjectInner<T>> snapshot) {
		@Nullable Throwable failure = null;
		for (SubjectInner<T> inner : snapshot) {
			try {
				inner.drain();
			}
			catch (Throwable e) {
				Exceptions.throwIfFatal(e);
				failure = addFailure(failure, e);
			}
		}
		if (failure != null) {
			throw Exceptions.propagate(failure);
		}
	}

	static Throwable addFailure(@Nullable Throwable first, Throwable next) {
		if (first == null) {
			return next;
		}
		if (first != next) {
			first.addSuppressed(next);
		}
		return first;
	}

	void remove(SubjectInner<T> inner) {
		synchronized (this) {
			subscribers.remove(inner.id);
		}
	}

	/**
	 * Update the replay state with a value about to be multicast. Called under the lock.
	 *
	 * @param value the value
	 */
	void record(T value) {
	}

	/**
	 * Enqueue the replayed values for a new subscriber. Called under the lock, before the
	 * subscriber is visible to emissions.
	 *
	 * @param inner the new subscriber entry
	 */
	void replay(SubjectInner<T> inner) {
	}

	/**
	 * @return true if at least one subscriber is attached
	 */
	public final boolean hasObservers() {
		return currentSubscriberCount() > 0;
	}

	/**
	 * @return the number of subscribers currently attached
	 */
	public final int currentSubscriberCount() {
		synchronized (this) {
			return subscribers.size();
		}
	}

	/**
	 * @return true once a terminal signal has been accepted
	 */
	public final boolean isTerminated() {
		return guard.isStopped();
	}

	/**
	 * @return true if this subject terminated with a completion
	 */
	public final boolean hasComplete() {
		synchronized (this) {
			return terminal != null && terminal.isOnComplete();
		}
	}

	/**
	 * @return the error this subject terminated with, or null
	 */
	public final @Nullable Throwable getThrowable() {
		synchronized (this) {
			return terminal == null ? null : terminal.getThrowable();
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{subscribers=" + currentSubscriberCount() + ", " + guard + "}";
	}
}
