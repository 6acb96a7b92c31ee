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

import java.util.List;
import javax.annotation.Nullable;

import tempo.bus.SchedulerContext;
import tempo.bus.registry.HandlerEntry;
import tempo.fn.Consumer;

/**
 * A {@code Router} walks an event through the handler chain registered for its type.
 *
 * @param <W> the world type
 */
public interface Router<W> {

	/**
	 * Routes {@code event} through {@code chain}, in order. If every handler lets the event through, the
	 * {@code completionConsumer} is invoked with it; if a handler breaks the chain it is not. In the event of an error
	 * thrown by a handler the {@code errorConsumer} is invoked, or, when it is {@code null}, the error is propagated to
	 * the caller.
	 *
	 * @param type               the type the event is routed under
	 * @param event              the event
	 * @param world              the world being stepped
	 * @param context            the context handed to each handler
	 * @param chain              the priority-ordered handlers for {@code type}
	 * @param completionConsumer invoked once the whole chain ran without a break, may be {@code null}
	 * @param errorConsumer      invoked when a handler fails, may be {@code null}
	 * @param <T>                the event type
	 */
	<T> void route(Class<T> type, T event, W world, SchedulerContext context,
	               List<HandlerEntry<T, W>> chain,
	               @Nullable Consumer<T> completionConsumer,
	               @Nullable Consumer<Throwable> errorConsumer);

}
