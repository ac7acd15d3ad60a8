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

package io.coedit.exception;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public final class StacklessExceptionTest {
	@Test
	public void testToString() {
		StacklessException e = new StacklessException("failed");
		assertSame(e, e.fillInStackTrace());
		assertEquals("StacklessException: failed", e.toString());
	}

	@Test
	public void testComponentInToString() {
		StacklessException e = new StacklessException(StacklessExceptionTest.class, "failed");
		assertEquals(StacklessExceptionTest.class, e.getComponent());
		assertEquals("StacklessExceptionTest | StacklessException: failed", e.toString());
	}
}
