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

package tempo.bus.handler;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import tempo.bus.EventResult;
import tempo.bus.Scheduler;
import tempo.core.observe.Observer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

public class HandlersTests {

	static final class Ping {
		final int n;

		Ping(int n) {
			this.n = n;
		}
	}

	static final class Pong {
		final int n;

		Pong(int n) {
			this.n = n;
		}
	}

	private final Scheduler<List<String>> scheduler = Scheduler.create();
	private final List<String>            world     = new ArrayList<String>();

	@Test
	public void eventOnlyHandlerSeesTheEvent() {
		int[] seen = new int[1];
		scheduler.addSystem(Ping.class, Handlers.of(ping -> {
			seen[0] = ping.n;
			return EventResult.OK;
		}));

		scheduler.send(new Ping(13));
		scheduler.step(world);

		assertThat(seen[0], is(13));
	}

	@Test
	public void worldHandlerSeesTheSteppedWorld() {
		scheduler.addSystem(Ping.class, Handlers.withWorld((ping, w) -> {
			w.add("ping " + ping.n);
			return EventResult.OK;
		}));

		scheduler.send(new Ping(1));
		scheduler.step(world);

		assertThat(world, contains("ping 1"));
	}

	@Test
	public void contextHandlerEmitsFollowUps() {
		scheduler.addSystem(Ping.class, Handlers.withContext((ping, cx) -> {
			cx.sendImmediate(new Pong(17 + ping.n));
			return EventResult.OK;
		}));
		Observer<Pong> pongs = scheduler.observe(Pong.class);

		scheduler.send(new Ping(13));
		scheduler.step(world);
		scheduler.step(world);

		assertThat(pongs.mapNext(pong -> pong.n), is(30));
	}

	@Test
	public void worldAndContextHandlerDoesBoth() {
		scheduler.addSystem(Ping.class, Handlers.withWorldAndContext((ping, w, cx) -> {
			w.add("ping " + ping.n);
			cx.sendDelayed(new Pong(ping.n));
			return EventResult.OK;
		}));
		scheduler.addSystem(Pong.class, Handlers.withWorld((pong, w) -> {
			w.add("pong " + pong.n);
			return EventResult.OK;
		}));

		scheduler.send(new Ping(13));
		scheduler.drain(world);

		assertThat(world, contains("ping 13", "pong 13"));
	}

	@Test
	public void canonicalHandlersAreNotWrapped() {
		EventHandler<Ping, List<String>> handler = (ping, w, cx) -> EventResult.OK;

		assertThat(Handlers.withWorldAndContext(handler), sameInstance(handler));
	}

	@Test
	public void adaptersDescribeTheHandlerTheyWrap() {
		EventOnlyHandler<Ping> handler = new EventOnlyHandler<Ping>() {
			@Override
			public EventResult handle(Ping event) {
				return EventResult.OK;
			}

			@Override
			public String toString() {
				return "pingHandler";
			}
		};

		assertThat(Handlers.<Ping, Object>of(handler).toString(), is("pingHandler"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void nullHandlersAreRejected() {
		Handlers.withWorld(null);
	}

}
