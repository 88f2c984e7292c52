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
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;

/**
 * A support class that offers factory methods for {@link Disposable} and
 * {@link Disposable.Composite} implementations, plus the atomic field helpers used by
 * subscription adapters to hold a resource slot.
 *
 */
public final class Disposables {

	private Disposables() { }

	/**
	 * Create a new empty {@link Disposable.Composite} with atomic guarantees on all mutative
	 * operations.
	 *
	 * @return an empty atomic {@link Disposable.Composite}
	 */
	public static Disposable.Composite composite() {
		return new ListCompositeDisposable();
	}

	/**
	 * Create and initialize a new {@link Disposable.Composite} with atomic guarantees on
	 * all mutative operations. Disposing it disposes the given fixed set of children.
	 *
	 * @param disposables the initial content
	 * @return a pre-filled atomic {@link Disposable.Composite}
	 */
	public static Disposable.Composite composite(Disposable... disposables) {
		return new ListCompositeDisposable(disposables);
	}

	/**
	 * Create and initialize a new {@link Disposable.Composite} with atomic guarantees on
	 * all mutative operations.
	 *
	 * @param disposables the initial content
	 * @return a pre-filled atomic {@link Disposable.Composite}
	 */
	public static Disposable.Composite composite(Iterable<? extends Disposable> disposables) {
		return new ListCompositeDisposable(disposables);
	}

	/**
	 * Create a {@link Disposable} that runs the given release action exactly once, on
	 * the first call to {@link Disposable#dispose()}.
	 *
	 * @param action the release action
	 * @return a new {@link Disposable} backed by the action
	 */
	public static Disposable fromRunnable(Runnable action) {
		return new ActionDisposable(action);
	}

	/**
	 * Return a new {@link Disposable} that is already disposed.
	 *
	 * @return a new disposed {@link Disposable}.
	 */
	public static Disposable disposed() {
		return new AlwaysDisposable();
	}

	/**
	 * Return a new {@link Disposable} that can never be disposed. Calling {@link Disposable#dispose()}
	 * is a NO-OP and {@link Disposable#isDisposed()} always return false.
	 *
	 * @return a new {@link Disposable} that can never be disposed.
	 */
	public static Disposable never() {
		return new NeverDisposable();
	}

	/**
	 * Return a new simple {@link Disposable} instance that is initially not disposed but
	 * can be by calling {@link Disposable#dispose()}.
	 *
	 * @return a new {@link Disposable} initially not yet disposed.
	 */
	public static Disposable single() {
		return new SimpleDisposable();
	}

	/**
	 */
	static final class ListCompositeDisposable implements Disposable.Composite {

		@Nullable
		List<Disposable> resources;

		volatile boolean disposed;

		ListCompositeDisposable() {
		}

		ListCompositeDisposable(Disposable... resources) {
			Objects.requireNonNull(resources, "resources is null");
			this.resources = new ArrayList<>(resources.length);
			for (Disposable d : resources) {
				Objects.requireNonNull(d, "Disposable item is null");
				this.resources.add(d);
			}
		}

		ListCompositeDisposable(Iterable<? extends Disposable> resources) {
			Objects.requireNonNull(resources, "resources is null");
			this.resources = new ArrayList<>();
			for (Disposable d : resources) {
				Objects.requireNonNull(d, "Disposable item is null");
				this.resources.add(d);
			}
		}

		@Override
		public void dispose() {
			if (disposed) {
				return;
			}
			List<Disposable> set;
			synchronized (this) {
				if (disposed) {
					return;
				}
				disposed = true;
				set = resources;
				resources = null;
			}

			dispose(set);
		}

		@Override
		public boolean isDisposed() {
			return disposed;
		}

		@Override
		public boolean add(Disposable d) {
			Objects.requireNonNull(d, "d is null");
			if (!disposed) {
				synchronized (this) {
					if (!disposed) {
						List<Disposable> set = resources;
						if (set == null) {
							set = new ArrayList<>();
							resources = set;
						}
						set.add(d);
						return true;
					}
				}
			}
			d.dispose();
			return false;
		}

		@Override
		public boolean addAll(Collection<? extends Disposable> ds) {
			Objects.requireNonNull(ds, "ds is null");
			if (!disposed) {
				synchronized (this) {
					if (!disposed) {
						List<Disposable> set = resources;
						if (set == null) {
							set = new ArrayList<>(ds.size());
							resources = set;
						}
						for (Disposable d : ds) {
							Objects.requireNonNull(d, "d is null");
							set.add(d);
						}
						return true;
					}
				}
			}
			for (Disposable d : ds) {
				d.dispose();
			}
			return false;
		}

		@Override
		public boolean remove(Disposable d) {
			Objects.requireNonNull(d, "Disposable item is null");
			if (disposed) {
				return false;
			}
			synchronized (this) {
				if (disposed) {
					return false;
				}
				List<Disposable> set = resources;
				return set != null && set.remove(d);
			}
		}

		@Override
		public int size() {
			synchronized (this) {
				List<Disposable> r = resources;
				return r == null ? 0 : r.size();
			}
		}

		static void dispose(@Nullable List<Disposable> set) {
			if (set == null) {
				return;
			}
			List<Throwable> errors = null;
			for (Disposable o : set) {
				try {
					o.dispose();
				}
				catch (Throwable ex) {
					Exceptions.throwIfFatal(ex);
					if (errors == null) {
						errors = new ArrayList<>();
					}
					errors.add(ex);
				}
			}
			if (errors != null) {
				if (errors.size() == 1) {
					throw Exceptions.propagate(errors.get(0));
				}
				throw Exceptions.multiple(errors);
			}
		}

		@Override
		public String toString() {
			return "Composite[size=" + size() + ", disposed=" + disposed + "]";
		}
	}

	/**
	 * Runs its action on the first {@link #dispose()}, forgetting it afterwards.
	 */
	static final class ActionDisposable extends AtomicReference<Runnable> implements Disposable {

		private static final long serialVersionUID = -4421874813474227337L;

		ActionDisposable(Runnable action) {
			super(Objects.requireNonNull(action, "action"));
		}

		@Override
		public void dispose() {
			Runnable action = get();
			if (action != null) {
				action = getAndSet(null);
				if (action != null) {
					action.run();
				}
			}
		}

		@Override
		public boolean isDisposed() {
			return get() == null;
		}
	}

	/**
	 * A very simple {@link Disposable} that only wraps a mutable boolean for
	 * {@link #isDisposed()}.
	 */
	static final class SimpleDisposable extends AtomicBoolean implements Disposable {

		private static final long serialVersionUID = 2133456733567789032L;

		@Override
		public void dispose() {
			set(true);
		}

		@Override
		public boolean isDisposed() {
			return get();
		}
	}

	static final class AlwaysDisposable implements Disposable {

		@Override
		public void dispose() {
			//NO-OP
		}

		@Override
		public boolean isDisposed() {
			return true;
		}
	}

	static final class NeverDisposable implements Disposable {

		@Override
		public void dispose() {
			//NO-OP
		}

		@Override
		public boolean isDisposed() {
			return false;
		}
	}

	//==== atomic resource slot helpers ====

	/**
	 * A singleton {@link Disposable} that marks a resource slot as disposed. Should not be
	 * leaked to clients.
	 */
	static final Disposable DISPOSED = disposed();

	/**
	 * Atomically set the slot to a {@link Disposable} without disposing the previous content.
	 * If the slot was already disposed, {@code newValue} is disposed instead.
	 *
	 * @param updater the target field updater
	 * @param holder the target instance holding the field
	 * @param newValue the new Disposable to set, null allowed
	 * @return true if the operation succeeded, false if the slot was disposed
	 */
	public static <T> boolean replace(AtomicReferenceFieldUpdater<T, Disposable> updater,
			T holder, @Nullable Disposable newValue) {
		for (;;) {
			Disposable current = updater.get(holder);
			if (current == DISPOSED) {
				if (newValue != null) {
					newValue.dispose();
				}
				return false;
			}
			if (updater.compareAndSet(holder, current, newValue)) {
				return true;
			}
		}
	}

	/**
	 * Atomically dispose the {@link Disposable} in the slot if not already disposed, and
	 * mark the slot so that later {@link #replace} calls dispose their argument.
	 *
	 * @param updater the target field updater
	 * @param holder the target instance holding the field
	 * @return true if this call transitioned the slot to disposed
	 */
	public static <T> boolean dispose(AtomicReferenceFieldUpdater<T, Disposable> updater, T holder) {
		Disposable current = updater.get(holder);
		Disposable d = DISPOSED;
		if (current != d) {
			current = updater.getAndSet(holder, d);
			if (current != d) {
				if (current != null) {
					current.dispose();
				}
				return true;
			}
		}
		return false;
	}

	/**
	 * Check if the given slot content is the disposed marker.
	 *
	 * @param d the slot content to check
	 * @return true if d marks a disposed slot
	 */
	public static boolean isDisposed(@Nullable Disposable d) {
		return d == DISPOSED;
	}
}
