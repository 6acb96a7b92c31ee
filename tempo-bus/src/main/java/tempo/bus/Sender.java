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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import com.gs.collections.impl.list.mutable.FastList;

/**
 * Staging buffer for the follow-up events handlers emit while an epoch is being dispatched.
 */
final class Sender {

	private final FastList<ScheduledEvent<?>> immediate = FastList.newList();
	private final Deque<ScheduledEvent<?>>    delayed   = new ArrayDeque<ScheduledEvent<?>>();

	void sendImmediate(ScheduledEvent<?> event) {
		immediate.add(event);
	}

	void sendDelayed(ScheduledEvent<?> event) {
		delayed.addLast(event);
	}

	boolean isEmpty() {
		return immediate.isEmpty() && delayed.isEmpty();
	}

	/**
	 * Move everything staged so far into {@code queue}: all immediate events as one epoch at the front, then each
	 * delayed event as its own epoch at the back, both in staging order.
	 */
	void drainInto(Deque<List<ScheduledEvent<?>>> queue) {
		if (!immediate.isEmpty()) {
			queue.addFirst(FastList.newList(immediate));
			immediate.clear();
		}
		ScheduledEvent<?> event;
		while (null != (event = delayed.pollFirst())) {
			queue.addLast(Collections.<ScheduledEvent<?>>singletonList(event));
		}
	}

	void clear() {
		immediate.clear();
		delayed.clear();
	}

}
