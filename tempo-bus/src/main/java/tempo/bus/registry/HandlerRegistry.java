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

import javax.annotation.Nullable;

import com.gs.collections.impl.map.mutable.UnifiedMap;
import tempo.core.observe.ObservableLog;
import tempo.core.support.Assert;

/**
 * Maps each event type to its {@link HandlerSet}. Entries are created lazily and live as long as the registry.
 * <p>
 * The registry is keyed by the very {@link Class} an event is routed under, which is what makes the unchecked cast in
 * {@link #find(Class)} safe: a {@code HandlerSet<T, W>} is only ever stored under {@code Class<T>}.
 * <p>
 * Not thread-safe; it is owned by the scheduler thread.
 *
 * @param <W> the world type
 */
public class HandlerRegistry<W> {

	private final UnifiedMap<Class<?>, HandlerSet<?, W>> sets = UnifiedMap.newMap();

	/**
	 * Find the set for {@code type}, creating an empty one if needed.
	 *
	 * @param type the event type
	 * @param <T>  the event type
	 * @return the set registered for {@code type}
	 */
	public <T> HandlerSet<T, W> getOrCreate(Class<T> type) {
		Assert.notNull(type, "Event type cannot be null.");
		HandlerSet<T, W> set = find(type);
		if (null == set) {
			set = new HandlerSet<T, W>(type);
			sets.put(type, set);
		}
		return set;
	}

	/**
	 * Find the set for {@code type} without creating one.
	 *
	 * @param type the event type
	 * @param <T>  the event type
	 * @return the set, or {@code null} if nothing ever registered for or observed {@code type}
	 */
	@Nullable
	@SuppressWarnings("unchecked")
	public <T> HandlerSet<T, W> find(Class<T> type) {
		return (HandlerSet<T, W>) sets.get(type);
	}

	public boolean contains(Class<?> type) {
		return sets.containsKey(type);
	}

	public int size() {
		return sets.size();
	}

	/**
	 * Close the {@link ObservableLog} of every set.
	 */
	public void closeAll() {
		for (HandlerSet<?, W> set : sets.valuesView()) {
			set.close();
		}
	}

}
