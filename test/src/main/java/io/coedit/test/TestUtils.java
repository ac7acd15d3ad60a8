/*
 * Copyright (C) 2015-2018 SoftIndex LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.coedit.test;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

public class TestUtils {
	private static final long POLL_INTERVAL_MILLIS = 5;

	public static void enableLogging(String name, Level level) {
		ch.qos.logback.classic.Logger logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(name);
		logger.setLevel(level);
	}

	public static void enableLogging(Class<?> cls, Level level) {
		enableLogging(cls.getName(), level);
	}

	public static void enableLogging(Level level) {
		enableLogging(Logger.ROOT_LOGGER_NAME, level);
	}

	public static void enableLogging(String name) {
		enableLogging(name, Level.TRACE);
	}

	public static void enableLogging() {
		enableLogging(Logger.ROOT_LOGGER_NAME, Level.TRACE);
	}

	/**
	 * Polls the condition until it holds, failing with an {@link AssertionError}
	 * once the timeout is exceeded.
	 */
	public static void await(BooleanSupplier condition, Duration timeout) {
		await(condition, timeout, () -> "Condition not met within " + timeout);
	}

	public static void await(BooleanSupplier condition, Duration timeout, Supplier<String> message) {
		long deadline = System.nanoTime() + timeout.toNanos();
		while (!condition.getAsBoolean()) {
			if (System.nanoTime() > deadline) {
				throw new AssertionError(message.get());
			}
			try {
				Thread.sleep(POLL_INTERVAL_MILLIS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new AssertionError("Interrupted while waiting", e);
			}
		}
	}

	/**
	 * Runs the given action and returns the exception it throws,
	 * failing if nothing or something of another type was thrown.
	 */
	@SuppressWarnings("unchecked")
	public static <E extends Throwable> E assertThrows(Class<E> errorClass, ThrowingRunnable action) {
		try {
			action.run();
		} catch (Throwable e) {
			if (errorClass.isInstance(e)) {
				return (E) e;
			}
			throw new AssertionError("Expected an error of type " + errorClass.getName() + ", but got " + e.getClass().getSimpleName(), e);
		}
		throw new AssertionError("Expected an error of type " + errorClass.getName());
	}

	@FunctionalInterface
	public interface ThrowingRunnable {
		void run() throws Throwable;
	}
}
