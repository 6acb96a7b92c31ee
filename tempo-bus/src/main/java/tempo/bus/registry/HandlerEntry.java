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

package tempo.bus.registry;

import java.util.Comparator;

import tempo.bus.handler.EventHandler;

/**
 * One link of a handler chain: a handler tagged with its priority and its registration order.
 *
 * @param <T> the event type
 * @param <W> the world type
 */
public class HandlerEntry<T, W> {

	/**
	 * Ascending priority; registration order among equal priorities.
	 */
	static final Comparator<HandlerEntry<?, ?>> EXECUTION_ORDER = new Comparator<HandlerEntry<?, ?>>() {
		@Override
		public int compare(HandlerEntry<?, ?> a, HandlerEntry<?, ?> b) {
			int c = Integer.compare(a.priority, b.priority);
			return c != 0 ? c : Long.compare(a.ordinal, b.ordinal);
		}
	};

	private final int                 priority;
	private final long                ordinal;
	private final EventHandler<T, W> handler;

	HandlerEntry(int priority, long ordinal, EventHandler<T, W> handler) {
		this.priority = priority;
		this.ordinal = ordinal;
		this.handler = handler;
	}

	public int getPriority() {
		return priority;
	}

	public EventHandler<T, W> getHandler() {
		return handler;
	}

	@Override
	public String toString() {
		return "HandlerEntry{" +
		  "priority=" + priority +
		  ", handler=" + handler +
		  '}';
	}

}
