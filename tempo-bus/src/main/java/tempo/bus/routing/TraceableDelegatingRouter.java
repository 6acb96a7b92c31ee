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
import tempo.bus.SchedulerContext;
import tempo.bus.registry.HandlerEntry;
import tempo.core.support.Assert;
import tempo.fn.Consumer;

/**
 * @author Jon Brisbin
 */
public class TraceableDelegatingRouter<W> implements Router<W> {

	private final Router<W> delegate;
	private final Logger    log;

	public TraceableDelegatingRouter(Router<W> delegate) {
		Assert.notNull(delegate, "Delegate Router cannot be null.");
		this.delegate = delegate;
		this.log = LoggerFactory.getLogger(delegate.getClass());
	}

	@Override
	public <T> void route(Class<T> type, T event, W world, SchedulerContext context,
	                      List<HandlerEntry<T, W>> chain,
	                      @Nullable Consumer<T> completionConsumer,
	                      @Nullable Consumer<Throwable> errorConsumer) {
		if (log.isTraceEnabled()) {
			log.trace("route({}, {}, {}, {}, {})", type.getName(), event, chain, completionConsumer, errorConsumer);
		}
		delegate.route(type, event, world, context, chain, completionConsumer, errorConsumer);
	}

	public Router<W> getDelegate() {
		return delegate;
	}

}
