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

import javax.annotation.Nonnull;

import tempo.core.support.Assert;

/**
 * Capability handed to handlers for the duration of a single event's dispatch, used to emit follow-up events.
 * <p>
 * Events sent with {@link #sendImmediate(Object)} during an epoch are gathered, across all handlers and all events of
 * that epoch, into one new epoch that runs on the very next {@link Scheduler#step(Object)}. Events sent with
 * {@link #sendDelayed(Object)} are each appended as their own epoch behind everything already queued.
 * <p>
 * A context must not be kept beyond the handler invocation that received it; using it afterwards fails with an
 * {@link IllegalStateException}.
 */
public final class SchedulerContext {

	private Sender sender;

	SchedulerContext(Sender sender) {
		this.sender = sender;
	}

	/**
	 * Stage {@code event}, routed under its runtime class, for the epoch that directly follows the current one.
	 *
	 * @param event the event to send
	 * @param <T>   the event type
	 */
	public <T> void sendImmediate(@Nonnull T event) {
		sender().sendImmediate(ScheduledEvent.of(event));
	}

	/**
	 * Stage {@code event}, routed under {@code type}, for the epoch that directly follows the current one.
	 *
	 * @param type  the type to route the event under
	 * @param event the event to send
	 * @param <T>   the event type
	 */
	public <T> void sendImmediate(@Nonnull Class<T> type, @Nonnull T event) {
		sender().sendImmediate(ScheduledEvent.of(type, event));
	}

	/**
	 * Stage {@code event}, routed under its runtime class, as a new epoch at the tail of the queue.
	 *
	 * @param event the event to send
	 * @param <T>   the event type
	 */
	public <T> void sendDelayed(@Nonnull T event) {
		sender().sendDelayed(ScheduledEvent.of(event));
	}

	/**
	 * Stage {@code event}, routed under {@code type}, as a new epoch at the tail of the queue.
	 *
	 * @param type  the type to route the event under
	 * @param event the event to send
	 * @param <T>   the event type
	 */
	public <T> void sendDelayed(@Nonnull Class<T> type, @Nonnull T event) {
		sender().sendDelayed(ScheduledEvent.of(type, event));
	}

	void release() {
		sender = null;
	}

	private Sender sender() {
		Assert.state(null != sender, "SchedulerContext cannot be used once its event has been dispatched.");
		return sender;
	}

}
