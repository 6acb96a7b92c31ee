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
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import javax.annotation.Nonnull;

import com.gs.collections.impl.list.mutable.FastList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.core.support.Assert;

/**
 * An append-only log shared by zero or more independent {@link Observer observers}.
 * <p>
 * Each observer owns a cursor pointing at the next unread item, relative to the current front of the buffer. The log
 * only keeps weak references to those cursors, so an observer that is no longer reachable (or that has been
 * {@link Observer#cancel() cancelled}) stops holding back history. Consumed history is reclaimed lazily: on every
 * {@link #push(Object)} the log drops dead observers, finds the smallest cursor among the live ones, discards that many
 * items from the front and shifts every cursor back by the same amount.
 * <p>
 * A single thread is expected to write; any number of threads may read through their own observers.
 *
 * @param <T> the type of the published items
 */
public class ObservableLog<T> {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final LogBuffer<T>                           buffer    = new LogBuffer<T>();
	private final FastList<WeakReference<AtomicInteger>> observers = FastList.newList();

	/**
	 * Publish an item to every live observer. When nobody is subscribed the item is dropped right away.
	 *
	 * @param item the item to publish
	 */
	public void push(@Nonnull T item) {
		Assert.notNull(item, "Item cannot be null.");

		Lock writeLock = buffer.writeLock();
		writeLock.lock();
		try {
			if (buffer.isClosed() || observers.isEmpty()) {
				return;
			}
			buffer.items().add(item);
			synchronize();
		} finally {
			writeLock.unlock();
		}
	}

	/**
	 * Create a new {@link Observer} that will see every item pushed from now on, but none of the history.
	 *
	 * @return a new observer positioned at the end of the log
	 */
	public Observer<T> subscribe() {
		Lock writeLock = buffer.writeLock();
		writeLock.lock();
		try {
			AtomicInteger cursor = new AtomicInteger(buffer.items().size());
			WeakReference<AtomicInteger> tracker = new WeakReference<AtomicInteger>(cursor);
			observers.add(tracker);
			return new Observer<T>(cursor, tracker, new WeakReference<LogBuffer<T>>(buffer));
		} finally {
			writeLock.unlock();
		}
	}

	/**
	 * Number of items currently retained, i.e. published but not yet consumed by every live observer.
	 *
	 * @return the retained item count
	 */
	public int size() {
		Lock readLock = buffer.readLock();
		readLock.lock();
		try {
			return buffer.items().size();
		} finally {
			readLock.unlock();
		}
	}

	/**
	 * Number of tracked observers still alive. Cancelled or collected observers are not counted even if the next
	 * {@link #push(Object)} has not purged them yet.
	 *
	 * @return the live observer count
	 */
	public int observerCount() {
		Lock readLock = buffer.readLock();
		readLock.lock();
		try {
			int count = 0;
			for (WeakReference<AtomicInteger> ref : observers) {
				if (null != ref.get()) {
					count++;
				}
			}
			return count;
		} finally {
			readLock.unlock();
		}
	}

	/**
	 * Tear the log down. Retained items are released and outstanding observers read nothing from now on.
	 */
	public void close() {
		Lock writeLock = buffer.writeLock();
		writeLock.lock();
		try {
			buffer.close();
			buffer.items().clear();
			observers.clear();
		} finally {
			writeLock.unlock();
		}
	}

	public boolean isClosed() {
		return buffer.isClosed();
	}

	// must hold the write lock
	private void synchronize() {
		Iterator<WeakReference<AtomicInteger>> it = observers.iterator();
		int front = Integer.MAX_VALUE;
		while (it.hasNext()) {
			AtomicInteger cursor = it.next().get();
			if (null == cursor) {
				it.remove();
			} else {
				front = Math.min(front, cursor.get());
			}
		}

		List<T> items = buffer.items();
		front = Math.min(front, items.size());
		if (front == 0) {
			return;
		}

		for (WeakReference<AtomicInteger> ref : observers) {
			AtomicInteger cursor = ref.get();
			if (null != cursor) {
				cursor.addAndGet(-front);
			}
		}
		items.subList(0, front).clear();

		if (log.isTraceEnabled()) {
			log.trace("Trimmed {} consumed item(s), {} retained for {} observer(s)", front, items.size(),
			  observers.size());
		}
	}

	@Override
	public String toString() {
		return "ObservableLog{" +
		  "size=" + size() +
		  ", observers=" + observerCount() +
		  ", closed=" + isClosed() +
		  '}';
	}

}
