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

package tempo.core.error;

import java.util.HashSet;
import java.util.Set;

/**
 * Static helpers to decorate an error with the event that was being dispatched when it was raised.
 *
 * @author Stephane Maldini
 */
public abstract class Exceptions {

	private static final int MAX_DEPTH = 25;

	/**
	 * Adds a {@code Throwable} to a causality-chain of Throwables, as an additional cause (if it does not
	 * already appear in the chain among the causes).
	 *
	 * @param e     the {@code Throwable} at the head of the causality chain
	 * @param cause the {@code Throwable} you want to add as a cause of the chain
	 */
	public static void addCause(Throwable e, Throwable cause) {
		Set<Throwable> seenCauses = new HashSet<Throwable>();

		int i = 0;
		while (e.getCause() != null) {
			if (i++ >= MAX_DEPTH) {
				// stack too deep to associate cause
				return;
			}
			e = e.getCause();
			if (seenCauses.contains(e.getCause())) {
				break;
			} else {
				seenCauses.add(e.getCause());
			}
		}
		// 'e' is now the last in the chain; its cause may already have been fixed by its constructor
		if (e != cause) {
			try {
				e.initCause(cause);
			} catch (IllegalStateException alreadyInitialized) {
				e.addSuppressed(cause);
			}
		}
	}

	/**
	 * Try to find the value attached at the end of the causality-chain of a particular {@code Throwable}.
	 *
	 * @param e the {@code Throwable} to inspect
	 * @return the value carried by the final {@link ValueCause}, or {@code null} if the chain does not end with one
	 */
	public static Object getFinalValueCause(Throwable e) {
		Throwable t = getFinalCause(e);
		if (t instanceof ValueCause) {
			return ((ValueCause) t).getValue();
		}
		for (Throwable suppressed : t.getSuppressed()) {
			if (suppressed instanceof ValueCause) {
				return ((ValueCause) suppressed).getValue();
			}
		}
		return null;
	}

	/**
	 * Get the {@code Throwable} at the end of the causality-chain for a particular {@code Throwable}
	 *
	 * @param e the {@code Throwable} whose final cause you are curious about
	 * @return the last {@code Throwable} in the causality-chain of {@code e} (or a "Stack too deep to get
	 * final cause" {@code RuntimeException} if the chain is too long to traverse)
	 */
	public static Throwable getFinalCause(Throwable e) {
		int i = 0;
		while (e.getCause() != null) {
			if (i++ >= MAX_DEPTH) {
				return new RuntimeException("Stack too deep to get final cause");
			}
			e = e.getCause();
		}
		return e;
	}

	/**
	 * Adds the given item as the final cause of the given {@code Throwable}, wrapped in {@link ValueCause}.
	 *
	 * @param e     the {@link Throwable} to which you want to add a cause
	 * @param value the item you want to add to {@code e} as the cause of the {@code Throwable}
	 * @return the same {@code Throwable} ({@code e}) that was passed in, with {@code value} added to it as a
	 * cause
	 */
	public static Throwable addValueAsLastCause(Throwable e, Object value) {
		Throwable lastCause = Exceptions.getFinalCause(e);
		if (lastCause instanceof ValueCause) {
			// purposefully using == for object reference check
			if (((ValueCause) lastCause).getValue() == value) {
				return e;
			}
		}
		Exceptions.addCause(e, new ValueCause(value));
		return e;
	}

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error varieties. These
	 * varieties are as follows:
	 * <ul>
	 * <li>{@code StackOverflowError}</li>
	 * <li>{@code VirtualMachineError}</li>
	 * <li>{@code LinkageError}</li>
	 * </ul>
	 *
	 * @param t the error to inspect
	 */
	public static void throwIfFatal(Throwable t) {
		if (t instanceof StackOverflowError) {
			throw (StackOverflowError) t;
		} else if (t instanceof VirtualMachineError) {
			throw (VirtualMachineError) t;
		} else if (t instanceof LinkageError) {
			throw (LinkageError) t;
		}
	}

	/**
	 * Rethrow the given error unchanged if it is unchecked, otherwise wrap it into an {@code IllegalStateException}.
	 *
	 * @param t the error to propagate
	 * @return never returns normally; declared so callers can write {@code throw Exceptions.propagate(t)}
	 */
	public static RuntimeException propagate(Throwable t) {
		if (t instanceof RuntimeException) {
			throw (RuntimeException) t;
		}
		if (t instanceof Error) {
			throw (Error) t;
		}
		throw new IllegalStateException(t);
	}

	/**
	 * Represents an error that was encountered while dispatching an event, preserving the event for future use
	 * and/or reporting.
	 */
	public static class ValueCause extends RuntimeException {

		private static final long serialVersionUID = -3454462756050397899L;
		private final transient Object value;

		/**
		 * Create a {@code ValueCause} error and include in its error message a string representation of
		 * the item that was being dispatched at the time the error was handled.
		 *
		 * @param value the item that was being dispatched at the time of the error
		 */
		public ValueCause(Object value) {
			super("Exception while dispatching value: " + renderValue(value));
			this.value = value;
		}

		public Object getValue() {
			return value;
		}

		/**
		 * Render the object if it is a basic type. This avoids potentially expensive or failing calls to
		 * toString() on arbitrary events.
		 */
		private static String renderValue(Object value) {
			if (value == null) {
				return "null";
			}
			if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
				return value.toString();
			}
			if (value instanceof String) {
				return (String) value;
			}
			if (value instanceof Enum) {
				return ((Enum<?>) value).name();
			}
			return value.getClass().getName() + ".class";
		}
	}

}
