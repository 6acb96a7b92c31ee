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

/**
 * Canonical form of a handler: receives the event, the world the scheduler is stepping and the context used to emit
 * follow-up events. Every other accepted shape is adapted into this one by {@link Handlers}.
 *
 * @param <T> the event type
 * @param <W> the world type
 */
public interface EventHandler<T, W> {

	/**
	 * Handle {@code event}.
	 *
	 * @param event   the event being dispatched; handlers later in the chain see any changes made to it
	 * @param world   the world passed to {@link tempo.bus.Scheduler#step(Object)}, only valid during this call
	 * @param context the context for emitting follow-up events, only valid during this call
	 * @return how the rest of the chain should proceed, never {@code null}
	 */
	EventResult handle(T event, W world, SchedulerContext context);

}
