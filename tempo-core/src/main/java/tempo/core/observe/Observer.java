/*
 * Copyright (c) 2011-2014 Pivotal Software, Inc.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package tempo.core.observe;

import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import tempo.core.support.Assert;
import tempo.fn.Function;

/**
 * A read handle into an {@link ObservableLog}, created by {@link ObservableLog#subscribe()}.
 * <p>
 * Reads never block and never fail: when the log has been closed or garbage collected, when this observer has been
 * cancelled, or when no unread item is available, {@link #next()} and {@link #mapNext(Function)} return
 * {@code null} without moving the cursor, so the caller can simply poll again later.
 * <p>
 * The cursor is an atomic counter and a read claims its slot with a compare-and-set, so one observer may be drained
 * from several threads at once: every item is then handed to exactly one of them. Readers sharing an observer split
 * its items between them; give each thread its own observer for every thread to see every item.
 * <p>
 * Items are handed out as-is, not copied: every observer of a log receives the same instance, so published items
 * should be immutable.
 *
 * @param <T> the type of the observed items
 */
public class Observer<T> {

	private final AtomicInteger                cursor;
	private final WeakReference<AtomicInteger> tracker;
	private final WeakReference<LogBuffer<T>>  buffer;

	private volatile boolean cancelled = false;

	Observer(AtomicInteger cursor, WeakReference<AtomicInteger> tracker, WeakReference<LogBuffer<T>> buffer) {
		this.cursor = cursor;
		this.tracker = tracker;
		this.buffer = buffer;
	}

	/**
	 * Consume the next unread item.
	 *
	 * @return the next item, or {@code null} if nothing is available
	 */
	@Nullable
	public T next() {
		return claim();
	}

	/**
	 * Consume the next unread item and return the result of applying {@code fn} to it. The item counts as consumed
	 * even if {@code fn} throws. {@code fn} runs without holding any lock of the log.
	 *
	 * @param fn  the transformation to apply
	 * @param <V> the type of the transformed value
	 * @return the transformed value, or {@code null} if nothing is available
	 */
	@Nullable
	public <V> V mapNext(@Nonnull Function<? super T, ? extends V> fn) {
		Assert.notNull(fn, "Function cannot be null.");
		T item = claim();
		return null == item ? null : fn.apply(item);
	}

	/**
	 * Number of items published since this observer's last read and not yet consumed by it.
	 *
	 * @return the unread item count, {@literal 0} once cancelled or closed
	 */
	public int available() {
		LogBuffer<T> b = liveBuffer();
		if (null == b) {
			return 0;
		}
		Lock readLock = b.readLock();
		readLock.lock();
		try {
			return b.isClosed() ? 0 : Math.max(0, b.items().size() - cursor.get());
		} finally {
			readLock.unlock();
		}
	}

	/**
	 * Stop observing. The owning log notices on its next push, exactly as if this observer had been collected.
	 */
	public void cancel() {
		cancelled = true;
		tracker.clear();
	}

	public boolean isCancelled() {
		return cancelled;
	}

	@Nullable
	private T claim() {
		LogBuffer<T> b = liveBuffer();
		if (null == b) {
			return null;
		}
		Lock readLock = b.readLock();
		readLock.lock();
		try {
			if (b.isClosed()) {
				return null;
			}
			// readers of a shared observer race on the cursor, only the winner of a slot returns its item
			for (;;) {
				int index = cursor.get();
				if (index >= b.items().size()) {
					return null;
				}
				if (cursor.compareAndSet(index, index + 1)) {
					return b.items().get(index);
				}
			}
		} finally {
			readLock.unlock();
		}
	}

	@Nullable
	private LogBuffer<T> liveBuffer() {
		return cancelled ? null : buffer.get();
	}

	@Override
	public String toString() {
		return "Observer{" +
		  "cursor=" + cursor.get() +
		  ", cancelled=" + cancelled +
		  '}';
	}

}
