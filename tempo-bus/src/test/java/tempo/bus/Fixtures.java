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

import java.util.ArrayList;
import java.util.List;

/**
 * Events and world shared by the scheduler tests.
 */
final class Fixtures {

	private Fixtures() {
	}

	static class World {
		int          value;
		List<String> trace = new ArrayList<String>();
	}

	static class Attack {
		int value;

		Attack(int value) {
			this.value = value;
		}

		@Override
		public String toString() {
			return "Attack(" + value + ")";
		}
	}

	static final class Damage {
		final int value;

		Damage(int value) {
			this.value = value;
		}

		@Override
		public String toString() {
			return "Damage(" + value + ")";
		}
	}

	static final class CriticalAttack extends Attack {
		CriticalAttack(int value) {
			super(value);
		}
	}

	static final class Tick {
		final String name;

		Tick(String name) {
			this.name = name;
		}

		@Override
		public String toString() {
			return name;
		}
	}

}
