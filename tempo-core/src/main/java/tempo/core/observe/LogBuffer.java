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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Storage shared between an {@link ObservableLog} and its {@link Observer observers}. The log is the only writer,
 * observers only ever take the read lock.
 *
 * @param <T> the type of the buffered items
 */
final class LogBuffer<T> {

	private final ReentrantReadWriteLock readWriteLock = new ReentrantReadWriteLock();
	private final Lock                   readLock      = readWriteLock.readLock();
	private final Lock                   writeLock     = readWriteLock.writeLock();
	private final List<T>                items         = new ArrayList<T>();

	private volatile boolean closed = false;

	Lock readLock() {
		return readLock;
	}

	Lock writeLock() {
		return writeLock;
	}

	/**
	 * Items relative to the current front. Guarded by the read/write lock.
	 */
	List<T> items() {
		return items;
	}

	boolean isClosed() {
		return closed;
	}

	void close() {
		closed = true;
	}

}
