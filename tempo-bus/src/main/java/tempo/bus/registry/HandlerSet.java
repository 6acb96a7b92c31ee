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

import java.util.List;
import javax.annotation.Nullable;

import com.gs.collections.impl.list.mutable.FastList;
import tempo.bus.SchedulerContext;
import tempo.bus.handler.EventHandler;
import tempo.bus.routing.Router;
import tempo.core.observe.ObservableLog;
import tempo.core.observe.Observer;
import tempo.fn.Consumer;

/**
 * Everything the scheduler keeps for one event type: the priority-ordered handler chain and the log that fully
 * processed events of that type are published to.
 *
 * @param <T> the event type
 * @param <W> the world type
 */
public class HandlerSet<T, W> {

	private final Class<T>         type;
	private final ObservableLog<T> observable = new ObservableLog<T>();
	private final Consumer<T>      publisher  = new Consumer<T>() {
		@Override
		public void accept(T event) {
			observable.push(event);
		}
	};

	private volatile List<HandlerEntry<T, W>> chain = FastList.<HandlerEntry<T, W>>newList().asUnmodifiable();
	private long registrations;

	HandlerSet(Class<T> type) {
		this.type = type;
	}

	public Class<T> getType() {
		return type;
	}

	/**
	 * Add {@code handler} to the chain. The chain is copied on write, so a dispatch already in progress keeps running
	 * against the chain it started with.
	 *
	 * @param handler  the handler
	 * @param priority lower values run first
	 */
	public void add(EventHandler<T, W> handler, int priority) {
		FastList<HandlerEntry<T, W>> next = FastList.newList(chain);
		next.add(new HandlerEntry<T, W>(priority, registrations++, handler));
		next.sortThis(HandlerEntry.EXECUTION_ORDER);
		chain = next.asUnmodifiable();
	}

	/**
	 * Run {@code event} through the chain using {@code router}. The event is published to this type's log only if
	 * the router reaches the end of the chain.
	 *
	 * @param event        the event
	 * @param world        the world being stepped
	 * @param context      the context for follow-up events
	 * @param router       the router walking the chain
	 * @param errorHandler receives handler failures, may be {@code null}
	 */
	public void handle(T event, W world, SchedulerContext context, Router<W> router,
	                   @Nullable Consumer<Throwable> errorHandler) {
		router.route(type, event, world, context, chain, publisher, errorHandler);
	}

	public Observer<T> observe() {
		return observable.subscribe();
	}

	public List<HandlerEntry<T, W>> getChain() {
		return chain;
	}

	public int size() {
		return chain.size();
	}

	ObservableLog<T> getObservable() {
		return observable;
	}

	void close() {
		observable.close();
	}

	@Override
	public String toString() {
		return "HandlerSet{" +
		  "type=" + type.getName() +
		  ", chain=" + chain +
		  ", observable=" + observable +
		  '}';
	}

}
