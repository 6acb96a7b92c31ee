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

import tempo.bus.EventResult;
import tempo.bus.SchedulerContext;
import tempo.core.support.Assert;

/**
 * Factories adapting each accepted handler shape into an {@link EventHandler}. The factory name picks the shape, so
 * lambdas can be written with implicit parameter types:
 * <pre>
 * scheduler.addSystem(Hit.class, Handlers.withWorld((hit, world) -&gt; {
 *     world.damage(hit.target(), hit.amount());
 *     return EventResult.OK;
 * }));
 * </pre>
 */
public abstract class Handlers {

	/**
	 * Adapt a handler that only looks at the event.
	 *
	 * @param handler the handler to adapt
	 * @param <T>     the event type
	 * @param <W>     the world type
	 * @return the canonical handler
	 */
	public static <T, W> EventHandler<T, W> of(EventOnlyHandler<T> handler) {
		Assert.notNull(handler, "Handler cannot be null.");
		return new EventOnlyAdapter<T, W>(handler);
	}

	/**
	 * Adapt a handler that needs the world.
	 *
	 * @param handler the handler to adapt
	 * @param <T>     the event type
	 * @param <W>     the world type
	 * @return the canonical handler
	 */
	public static <T, W> EventHandler<T, W> withWorld(WorldHandler<T, W> handler) {
		Assert.notNull(handler, "Handler cannot be null.");
		return new WorldAdapter<T, W>(handler);
	}

	/**
	 * Adapt a handler that needs the context to emit follow-up events.
	 *
	 * @param handler the handler to adapt
	 * @param <T>     the event type
	 * @param <W>     the world type
	 * @return the canonical handler
	 */
	public static <T, W> EventHandler<T, W> withContext(ContextHandler<T> handler) {
		Assert.notNull(handler, "Handler cannot be null.");
		return new ContextAdapter<T, W>(handler);
	}

	/**
	 * A handler needing both the world and the context already has the canonical shape; this only exists so all four
	 * shapes read the same at registration.
	 *
	 * @param handler the handler
	 * @param <T>     the event type
	 * @param <W>     the world type
	 * @return {@code handler}
	 */
	public static <T, W> EventHandler<T, W> withWorldAndContext(EventHandler<T, W> handler) {
		Assert.notNull(handler, "Handler cannot be null.");
		return handler;
	}

	private static final class EventOnlyAdapter<T, W> implements EventHandler<T, W> {

		private final EventOnlyHandler<T> delegate;

		EventOnlyAdapter(EventOnlyHandler<T> delegate) {
			this.delegate = delegate;
		}

		@Override
		public EventResult handle(T event, W world, SchedulerContext context) {
			return delegate.handle(event);
		}

		@Override
		public String toString() {
			return delegate.toString();
		}
	}

	private static final class WorldAdapter<T, W> implements EventHandler<T, W> {

		private final WorldHandler<T, W> delegate;

		WorldAdapter(WorldHandler<T, W> delegate) {
			this.delegate = delegate;
		}

		@Override
		public EventResult handle(T event, W world, SchedulerContext context) {
			return delegate.handle(event, world);
		}

		@Override
		public String toString() {
			return delegate.toString();
		}
	}

	private static final class ContextAdapter<T, W> implements EventHandler<T, W> {

		private final ContextHandler<T> delegate;

		ContextAdapter(ContextHandler<T> delegate) {
			this.delegate = delegate;
		}

		@Override
		public EventResult handle(T event, W world, SchedulerContext context) {
			return delegate.handle(event, context);
		}

		@Override
		public String toString() {
			return delegate.toString();
		}
	}

}
