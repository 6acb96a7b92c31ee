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

/**
 * Outcome of a single handler invocation, steering the rest of the handler chain.
 */
public enum EventResult {

	/**
	 * The handler did its work; the next handler in the chain runs.
	 */
	OK,

	/**
	 * The handler declined to act. Processing carries on exactly as for {@link #OK}: the next handler runs and the
	 * event is still published once the chain completes.
	 */
	CONTINUE,

	/**
	 * Abort the chain. No later handler sees the event and it is never published to observers.
	 */
	BREAK

}
