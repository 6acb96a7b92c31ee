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
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.gs.collections.impl.list.mutable.FastList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.bus.handler.EventHandler;
import tempo.bus.registry.HandlerRegistry;
import tempo.bus.registry.HandlerSet;
import tempo.bus.routing.ChainRouter;
import tempo.bus.routing.Router;
import tempo.bus.spec.SchedulerSpec;
import tempo.core.observe.Observer;
import tempo.core.support.Assert;
import tempo.fn.Consumer;

/**
 * A turn-based, typed event scheduler.
 * <p>
 * Events of any class are queued in <em>epochs</em>: groups of events that are processed together by one call to
 * {@link #step(Object)}. Each event is run through the chain of handlers registered for its class, lowest priority
 * first, and handlers can mutate the world passed to {@code step} and emit follow-up events through their
 * {@link SchedulerContext}. Events that make it through their whole chain are then published to the
 * {@link Observer observers} of their type.
 * <p>
 * A scheduler is driven by a single thread, typically until it runs dry:
 * <pre>
 * Scheduler&lt;World&gt; scheduler = Scheduler.create();
 * scheduler.addSystemWithPriority(Hit.class, Handlers.withWorld(Game::validateHit), 0);
 * scheduler.addSystemWithPriority(Hit.class, Handlers.withWorld(Game::applyDamage), 1);
 * scheduler.send(new Hit(0, 2));
 * while (scheduler.step(world)) { }
 * </pre>
 * Only {@link Observer observers} may be used from other threads.
 *
 * @param <W> the type of the world handed to every handler
 */
public class Scheduler<W> {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final HandlerRegistry<W>              registry = new HandlerRegistry<W>();
	private final Deque<List<ScheduledEvent<?>>> queue    = new ArrayDeque<List<ScheduledEvent<?>>>();
	private final Sender                          sender   = new Sender();
	private final Router<W>                       router;
	private final Consumer<Throwable>             dispatchErrorHandler;

	private boolean dispatching = false;
	private boolean shutdown    = false;

	/**
	 * Create a scheduler with the default router and no dispatch error handler.
	 *
	 * @param <W> the world type
	 * @return a new scheduler
	 */
	public static <W> Scheduler<W> create() {
		return new SchedulerSpec<W>().get();
	}

	/**
	 * Create a new {@literal Scheduler}.
	 *
	 * @param router               the {@link Router} walking each event through its handler chain. May be
	 *                             {@code null} in which case a {@link ChainRouter} is used.
	 * @param dispatchErrorHandler receives errors thrown by handlers. May be {@code null} in which case errors are
	 *                             logged and propagated out of {@link #step(Object)}.
	 */
	public Scheduler(@Nullable Router<W> router, @Nullable Consumer<Throwable> dispatchErrorHandler) {
		this.router = (null == router ? new ChainRouter<W>() : router);
		this.dispatchErrorHandler = dispatchErrorHandler;
	}

	/**
	 * Register {@code handler} for events of {@code type} at priority {@literal 0}.
	 *
	 * @param type    the event type
	 * @param handler the handler, see {@link tempo.bus.handler.Handlers} for the accepted shapes
	 * @param <T>     the event type
	 * @return {@literal this}
	 */
	public <T> Scheduler<W> addSystem(@Nonnull Class<T> type, @Nonnull EventHandler<T, W> handler) {
		return addSystemWithPriority(type, handler, 0);
	}

	/**
	 * Register {@code handler} for events of {@code type}. Handlers run in ascending priority; handlers with the same
	 * priority run in registration order. Registering the same handler twice makes it run twice.
	 *
	 * @param type     the event type
	 * @param handler  the handler, see {@link tempo.bus.handler.Handlers} for the accepted shapes
	 * @param priority lower values run first
	 * @param <T>      the event type
	 * @return {@literal this}
	 */
	public <T> Scheduler<W> addSystemWithPriority(@Nonnull Class<T> type, @Nonnull EventHandler<T, W> handler,
	                                              int priority) {
		Assert.notNull(type, "Event type cannot be null.");
		Assert.notNull(handler, "Handler cannot be null.");
		assertRunning();

		registry.getOrCreate(type).add(handler, priority);
		if (log.isDebugEnabled()) {
			log.debug("Registered {} for {} at priority {}", handler, type.getName(), priority);
		}
		return this;
	}

	/**
	 * Queue {@code event}, routed under its runtime class, as a new epoch at the tail of the queue.
	 *
	 * @param event the event
	 * @param <T>   the event type
	 * @return {@literal this}
	 */
	public <T> Scheduler<W> send(@Nonnull T event) {
		assertRunning();
		queue.addLast(FastList.<ScheduledEvent<?>>newListWith(ScheduledEvent.of(event)));
		return this;
	}

	/**
	 * Queue {@code event}, routed under {@code type}, as a new epoch at the tail of the queue.
	 *
	 * @param type  the type to route the event under; handlers registered for subtypes or supertypes do not see it
	 * @param event the event
	 * @param <T>   the event type
	 * @return {@literal this}
	 */
	public <T> Scheduler<W> send(@Nonnull Class<T> type, @Nonnull T event) {
		assertRunning();
		queue.addLast(FastList.<ScheduledEvent<?>>newListWith(ScheduledEvent.of(type, event)));
		return this;
	}

	/**
	 * Queue {@code events} together, in iteration order, as a single new epoch at the tail of the queue.
	 *
	 * @param type   the type to route every event under
	 * @param events the events
	 * @param <T>    the event type
	 * @return {@literal this}
	 */
	public <T> Scheduler<W> sendMany(@Nonnull Class<T> type, @Nonnull Collection<? extends T> events) {
		Assert.notNull(events, "Events cannot be null.");
		assertRunning();
		FastList<ScheduledEvent<?>> epoch = FastList.newList(events.size());
		for (T event : events) {
			epoch.add(ScheduledEvent.of(type, event));
		}
		queue.addLast(epoch);
		return this;
	}

	/**
	 * Process the epoch at the head of the queue.
	 * <p>
	 * Every event of the epoch is run through the handler chain of its type; events of a type nothing was ever
	 * registered for or observed are discarded. Then the events handlers sent with
	 * {@link SchedulerContext#sendImmediate(Object)} become the next epoch, and each event sent with
	 * {@link SchedulerContext#sendDelayed(Object)} becomes its own epoch at the tail of the queue.
	 *
	 * @param world the world handed to every handler; must not be retained by them
	 * @return {@literal false} if the queue was empty and nothing happened, {@literal true} otherwise
	 * @throws IllegalStateException if called from within a handler
	 */
	public boolean step(W world) {
		Assert.state(!dispatching, "Scheduler.step() cannot be called while an epoch is being dispatched.");
		assertRunning();

		List<ScheduledEvent<?>> epoch = queue.pollFirst();
		if (null == epoch) {
			return false;
		}

		dispatching = true;
		try {
			for (ScheduledEvent<?> event : epoch) {
				dispatch(event, world);
			}
		} finally {
			dispatching = false;
			if (log.isTraceEnabled() && !sender.isEmpty()) {
				log.trace("Merging follow-up events staged by an epoch of {} event(s)", epoch.size());
			}
			sender.drainInto(queue);
		}
		return true;
	}

	/**
	 * Step until the queue is empty.
	 *
	 * @param world the world handed to every handler
	 * @return the number of epochs processed
	 */
	public int drain(W world) {
		int epochs = 0;
		while (step(world)) {
			epochs++;
		}
		return epochs;
	}

	/**
	 * Subscribe to the events of {@code type} that complete their handler chain from now on. No handler needs to be
	 * registered for {@code type}: with none, every event sent of that type is simply broadcast to its observers.
	 *
	 * @param type the event type
	 * @param <T>  the event type
	 * @return a new observer
	 */
	public <T> Observer<T> observe(@Nonnull Class<T> type) {
		assertRunning();
		return registry.getOrCreate(type).observe();
	}

	/**
	 * Are there any handlers registered for {@code type}.
	 *
	 * @param type the event type
	 * @return {@literal true} if at least one handler is registered for exactly {@code type}
	 */
	public boolean respondsTo(Class<?> type) {
		HandlerSet<?, W> set = registry.find(type);
		return null != set && set.size() > 0;
	}

	public boolean isEmpty() {
		return queue.isEmpty();
	}

	public int pendingEpochs() {
		return queue.size();
	}

	/**
	 * Discard every pending epoch and close the observable log of every event type, so that outstanding observers read
	 * nothing from now on. Shutdown is terminal: registering handlers, sending events, stepping and observing all fail
	 * with an {@link IllegalStateException} afterwards. Calling it again has no effect.
	 */
	public void shutdown() {
		Assert.state(!dispatching, "Scheduler.shutdown() cannot be called while an epoch is being dispatched.");
		if (shutdown) {
			return;
		}
		shutdown = true;
		int discarded = queue.size();
		queue.clear();
		sender.clear();
		registry.closeAll();
		log.debug("Scheduler shut down, {} pending epoch(s) discarded", discarded);
	}

	public boolean isShutdown() {
		return shutdown;
	}

	public HandlerRegistry<W> getRegistry() {
		return registry;
	}

	public Router<W> getRouter() {
		return router;
	}

	@Nullable
	public Consumer<Throwable> getDispatchErrorHandler() {
		return dispatchErrorHandler;
	}

	private void assertRunning() {
		Assert.state(!shutdown, "Scheduler has been shut down.");
	}

	private <T> void dispatch(ScheduledEvent<T> scheduled, W world) {
		HandlerSet<T, W> set = registry.find(scheduled.getType());
		if (null == set) {
			if (log.isTraceEnabled()) {
				log.trace("Discarding {}: no handler registered and no observer", scheduled);
			}
			return;
		}
		SchedulerContext context = new SchedulerContext(sender);
		try {
			set.handle(scheduled.getEvent(), world, context, router, dispatchErrorHandler);
		} finally {
			context.release();
		}
	}

	@Override
	public String toString() {
		return "Scheduler{" +
		  "types=" + registry.size() +
		  ", pendingEpochs=" + queue.size() +
		  ", router=" + router +
		  '}';
	}

}
