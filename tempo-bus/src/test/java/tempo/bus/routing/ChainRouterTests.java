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

package tempo.bus.routing;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import tempo.bus.EventResult;
import tempo.bus.handler.EventHandler;
import tempo.bus.handler.Handlers;
import tempo.bus.registry.HandlerRegistry;
import tempo.bus.registry.HandlerSet;
import tempo.core.error.Exceptions;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

public class ChainRouterTests {

	private final Router<List<String>> router    = new ChainRouter<List<String>>();
	private final List<String>         world     = new ArrayList<String>();
	private final List<String>         completed = new ArrayList<String>();
	private final List<Throwable>      errors    = new ArrayList<Throwable>();

	private HandlerSet<String, List<String>> set;

	@Before
	public void setup() {
		set = new HandlerRegistry<List<String>>().getOrCreate(String.class);
	}

	@Test
	public void completedChainInvokesTheCompletionConsumer() {
		set.add(recording("first", EventResult.OK), 0);
		set.add(recording("second", EventResult.CONTINUE), 1);
		set.add(recording("third", EventResult.OK), 2);

		route("event");

		assertThat(world, contains("first", "second", "third"));
		assertThat(completed, contains("event"));
	}

	@Test
	public void emptyChainCompletesImmediately() {
		route("event");

		assertThat(completed, contains("event"));
	}

	@Test
	public void breakStopsTheChainWithoutCompletion() {
		set.add(recording("first", EventResult.OK), 0);
		set.add(recording("breaker", EventResult.BREAK), 1);
		set.add(recording("never", EventResult.OK), 2);

		route("event");

		assertThat(world, contains("first", "breaker"));
		assertThat(completed, is(empty()));
	}

	@Test
	public void failuresGoToTheErrorConsumerWithTheEventAttached() {
		set.add(Handlers.of(event -> {
			throw new IllegalStateException("boom");
		}), 0);
		set.add(recording("never", EventResult.OK), 1);

		route("event");

		assertThat(world, is(empty()));
		assertThat(completed, is(empty()));
		assertThat(errors.size(), is(1));
		assertThat(errors.get(0), instanceOf(IllegalStateException.class));
		assertThat(Exceptions.getFinalValueCause(errors.get(0)), is((Object) "event"));
	}

	@Test
	public void missingResultIsAFailure() {
		set.add(Handlers.of(event -> null), 0);

		route("event");

		assertThat(completed, is(empty()));
		assertThat(errors.get(0), instanceOf(IllegalStateException.class));
	}

	@Test(expected = IllegalStateException.class)
	public void failuresPropagateWithoutAnErrorConsumer() {
		set.add(Handlers.of(event -> {
			throw new IllegalStateException("boom");
		}), 0);

		router.route(String.class, "event", world, null, set.getChain(), completed::add, null);
	}

	@Test(expected = StackOverflowError.class)
	public void fatalErrorsBypassTheErrorConsumer() {
		set.add(Handlers.of(event -> {
			throw new StackOverflowError();
		}), 0);

		route("event");
	}

	@Test
	public void traceableRouterDelegates() {
		TraceableDelegatingRouter<List<String>> traceable = new TraceableDelegatingRouter<List<String>>(router);
		set.add(recording("only", EventResult.OK), 0);

		traceable.route(String.class, "event", world, null, set.getChain(), completed::add, errors::add);

		assertThat(traceable.getDelegate(), is(router));
		assertThat(world, contains("only"));
		assertThat(completed, contains("event"));
	}

	private void route(String event) {
		router.route(String.class, event, world, null, set.getChain(), completed::add, errors::add);
	}

	private static EventHandler<String, List<String>> recording(String name, EventResult result) {
		return Handlers.withWorld((event, w) -> {
			w.add(name);
			return result;
		});
	}

}
