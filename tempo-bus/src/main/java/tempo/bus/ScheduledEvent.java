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

package tempo.bus;

import tempo.core.support.Assert;

/**
 * An event waiting in the scheduler queue, together with the type it is routed under.
 *
 * @param <T> the routing type
 */
final class ScheduledEvent<T> {

	private final Class<T> type;
	private final T        event;

	private ScheduledEvent(Class<T> type, T event) {
		this.type = type;
		this.event = event;
	}

	static <T> ScheduledEvent<T> of(Class<T> type, T event) {
		Assert.notNull(type, "Event type cannot be null.");
		Assert.notNull(event, "Event cannot be null.");
		Assert.isTrue(type.isInstance(event), "Event " + event + " is not an instance of " + type.getName());
		return new ScheduledEvent<T>(type, event);
	}

	@SuppressWarnings("unchecked")
	static <T> ScheduledEvent<T> of(T event) {
		Assert.notNull(event, "Event cannot be null.");
		return new ScheduledEvent<T>((Class<T>) event.getClass(), event);
	}

	Class<T> getType() {
		return type;
	}

	T getEvent() {
		return event;
	}

	@Override
	public String toString() {
		return type.getSimpleName() + "(" + event + ")";
	}

}
