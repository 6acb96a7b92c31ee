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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.bus.EventResult;
import tempo.bus.SchedulerContext;
import tempo.bus.registry.HandlerEntry;
import tempo.core.error.Exceptions;
import tempo.fn.Consumer;

/**
 * The default {@link Router}: runs the chain in order, stopping at the first {@link EventResult#BREAK} or failure.
 * {@link EventResult#OK} and {@link EventResult#CONTINUE} both move on to the next handler.
 *
 * @param <W> the world type
 */
public class ChainRouter<W> implements Router<W> {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	@Override
	public <T> void route(Class<T> type, T event, W world, SchedulerContext context,
	                      List<HandlerEntry<T, W>> chain,
	                      @Nullable Consumer<T> completionConsumer,
	                      @Nullable Consumer<Throwable> errorConsumer) {
		int size = chain.size();
		if (logger.isDebugEnabled()) {
			logger.debug("Executing {} handler(s) for {}", size, type.getName());
		}
		for (int i = 0; i < size; i++) {
			HandlerEntry<T, W> entry = chain.get(i);
			EventResult result;
			try {
				result = entry.getHandler().handle(event, world, context);
				if (null == result) {
					throw new IllegalStateException("Handler " + entry.getHandler() + " returned no EventResult for "
					  + type.getName());
				}
			} catch (Throwable t) {
				if (null != errorConsumer) {
					Exceptions.throwIfFatal(t);
					errorConsumer.accept(Exceptions.addValueAsLastCause(t, event));
					return;
				}
				logger.error("Event dispatch failed for {}: {}", entry.getHandler(), t.getMessage(), t);
				throw Exceptions.propagate(t);
			}
			if (EventResult.BREAK == result) {
				if (logger.isDebugEnabled()) {
					logger.debug("{} broke the chain for {} at priority {}", entry.getHandler(), type.getName(),
					  entry.getPriority());
				}
				return;
			}
		}
		if (null != completionConsumer) {
			completionConsumer.accept(event);
		}
	}

}
