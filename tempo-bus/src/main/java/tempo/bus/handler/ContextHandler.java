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
 * A handler that emits follow-up events but does not touch the world.
 *
 * @param <T> the event type
 */
public interface ContextHandler<T> {

	EventResult handle(T event, SchedulerContext context);

}
