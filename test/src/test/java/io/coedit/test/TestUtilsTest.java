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
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static io.coedit.test.TestUtils.assertThrows;
import static io.coedit.test.TestUtils.await;
import static io.coedit.test.TestUtils.enableLogging;
import static org.junit.Assert.*;

public final class TestUtilsTest {
	@Test
	public void testEnableLogging() {
		enableLogging(TestUtilsTest.class, Level.DEBUG);
		assertTrue(LoggerFactory.getLogger(TestUtilsTest.class).isDebugEnabled());
		enableLogging(TestUtilsTest.class, Level.WARN);
		assertFalse(LoggerFactory.getLogger(TestUtilsTest.class).isDebugEnabled());
	}

	@Test
	public void testAwait() {
		AtomicInteger polls = new AtomicInteger();
		await(() -> polls.incrementAndGet() >= 3, Duration.ofSeconds(5));
		assertEquals(3, polls.get());
	}

	@Test
	public void testAwaitTimesOut() {
		AssertionError e = assertThrows(AssertionError.class, () -> await(() -> false, Duration.ofMillis(20), () -> "never"));
		assertEquals("never", e.getMessage());
	}

	@Test
	public void testAssertThrowsRejectsOtherTypes() {
		try {
			assertThrows(IllegalStateException.class, () -> {
				throw new IllegalArgumentException();
			});
		} catch (AssertionError e) {
			assertTrue(e.getCause() instanceof IllegalArgumentException);
			return;
		}
		fail();
	}
}
