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

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import tempo.bus.EventResult;
import tempo.bus.SchedulerContext;
import tempo.bus.handler.EventHandler;
import tempo.core.observe.Observer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

public class HandlerRegistryTests {

	private final HandlerRegistry<Object> registry = new HandlerRegistry<Object>();

	@Test
	public void setsAreCreatedLazilyAndKept() {
		assertThat(registry.find(String.class), is(nullValue()));
		assertThat(registry.contains(String.class), is(false));

		HandlerSet<String, Object> set = registry.getOrCreate(String.class);

		assertThat(registry.find(String.class), sameInstance(set));
		assertThat(registry.getOrCreate(String.class), sameInstance(set));
		assertThat(set.getType(), sameInstance(String.class));
		assertThat(registry.size(), is(1));
	}

	@Test
	public void chainIsSortedByPriorityThenRegistrationOrder() {
		HandlerSet<String, Object> set = registry.getOrCreate(String.class);
		List<Integer> priorities = new ArrayList<Integer>();
		List<String> names = new ArrayList<String>();

		set.add(named("c"), 5);
		set.add(named("a"), -1);
		set.add(named("d"), 5);
		set.add(named("b"), 0);
		set.add(named("e"), 5);

		for (HandlerEntry<String, Object> entry : set.getChain()) {
			priorities.add(entry.getPriority());
			names.add(entry.getHandler().toString());
		}
		assertThat(priorities, contains(-1, 0, 5, 5, 5));
		assertThat(names, contains("a", "b", "c", "d", "e"));
	}

	@Test
	public void registrationDoesNotDisturbAChainBeingWalked() {
		HandlerSet<String, Object> set = registry.getOrCreate(String.class);
		set.add(named("a"), 0);

		List<HandlerEntry<String, Object>> walking = set.getChain();
		set.add(named("b"), 0);

		assertThat(walking.size(), is(1));
		assertThat(set.getChain(), is(not(sameInstance(walking))));
		assertThat(set.size(), is(2));
	}

	@Test(expected = UnsupportedOperationException.class)
	public void chainIsReadOnly() {
		registry.getOrCreate(String.class).getChain().clear();
	}

	@Test
	public void closeAllTearsDownEveryLog() {
		Observer<String> strings = registry.getOrCreate(String.class).observe();
		Observer<Integer> integers = registry.getOrCreate(Integer.class).observe();
		registry.getOrCreate(String.class).getObservable().push("retained");

		registry.closeAll();

		assertThat(strings.next(), is(nullValue()));
		assertThat(integers.next(), is(nullValue()));
		assertThat(registry.find(Integer.class).getObservable().isClosed(), is(true));
	}

	private static EventHandler<String, Object> named(String name) {
		return new EventHandler<String, Object>() {
			@Override
			public EventResult handle(String event, Object world, SchedulerContext context) {
				return EventResult.OK;
			}

			@Override
			public String toString() {
				return name;
			}
		};
	}

}
