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

import java.util.Collection;

/**
 * Indicates that a subscription, task or resource can be released.
 * <p>Call to the dispose method is/should be idempotent and safe to invoke from any thread.
 */
@FunctionalInterface
public interface Disposable {

	/**
	 * Release the underlying subscription or resource.
	 * <p>
	 * Implementations are required to make this method idempotent: the release action
	 * runs at most once however many times and from however many threads this is called.
	 */
	void dispose();

	/**
	 * Optionally return {@literal true} when the resource or task is disposed.
	 * <p>
	 * Implementations are not required to track disposition and as such may never
	 * return {@literal true} even when disposed. However, they MUST only return true
	 * when there's a guarantee the resource or task is disposed.
	 *
	 * @return {@literal true} when there's a guarantee the resource or task is disposed.
	 */
	default boolean isDisposed() {
		return false;
	}

	/**
	 * Hand this {@link Disposable} over to the given {@link Composite}, so that its
	 * lifetime is bound to the container's. If the container is already disposed, this
	 * is disposed immediately.
	 *
	 * @param composite the owning container
	 * @return this {@link Disposable}, for chaining
	 */
	default Disposable disposeWith(Composite composite) {
		composite.add(this);
		return this;
	}

	/**
	 * A container of {@link Disposable} that is itself {@link Disposable}, usually held as
	 * a field by the object whose lifetime it represents. Accumulate disposables and
	 * dispose them all in one go by using {@link #dispose()}. Using the
	 * {@link #add(Disposable)} methods give ownership to the container, which is now
	 * responsible for disposing them. You can however retake ownership of individual
	 * elements by keeping a reference and using {@link #remove(Disposable)}, which puts
	 * the responsibility of disposing said elements back in your hands. Note that once
	 * disposed, the container cannot be reused and you will need a new {@link Composite}.
	 */
	interface Composite extends Disposable {

		/**
		 * Add a {@link Disposable} to this container, if it is not {@link #isDisposed() disposed}.
		 * Otherwise d is disposed immediately and not retained.
		 *
		 * @param d the {@link Disposable} to add.
		 * @return true if the disposable could be added, false otherwise.
		 */
		boolean add(Disposable d);

		/**
		 * Adds the given collection of Disposables to the container or disposes them
		 * all if the container has been disposed.
		 *
		 * @implNote The default implementation is not atomic, meaning that if the container is
		 * disposed while the content of the collection is added, first elements might be
		 * effectively added. Stronger consistency is enforced by composites created via
		 * {@link Disposables#composite()} variants.
		 * @param ds the collection of Disposables
		 * @return true if the operation was successful, false if the container has been disposed
		 */
		default boolean addAll(Collection<? extends Disposable> ds) {
			boolean abort = isDisposed();
			for (Disposable d : ds) {
				if (abort) {
					d.dispose();
				}
				else {
					//not added means the container got disposed meanwhile: dispose the rest
					abort = !add(d);
				}
			}
			return !abort;
		}

		/**
		 * Atomically mark the container as {@link #isDisposed() disposed}, clear it and then
		 * dispose all the previously contained Disposables, outside of any lock. From there
		 * on the container cannot be reused: {@link #add(Disposable)} disposes its argument
		 * and returns {@literal false}.
		 */
		@Override
		void dispose();

		/**
		 * Indicates if the container has already been disposed.
		 *
		 * @return true if the container has been disposed, false otherwise.
		 */
		@Override
		boolean isDisposed();

		/**
		 * Delete the {@link Disposable} from this container, without disposing it.
		 * <p>
		 * It becomes the responsibility of the caller to dispose the value themselves.
		 *
		 * @param d the {@link Disposable} to remove.
		 * @return true if the disposable was successfully deleted, false otherwise.
		 */
		boolean remove(Disposable d);

		/**
		 * Returns the number of currently held Disposables.
		 * @return the number of currently held Disposables
		 */
		int size();
	}
}
