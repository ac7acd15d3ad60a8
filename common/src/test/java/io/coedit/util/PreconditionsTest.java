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

package io.coedit.util;

import org.junit.Test;

import static io.coedit.util.Preconditions.*;
import static org.junit.Assert.*;

public final class PreconditionsTest {
	@Test
	public void testCheckNotNull() {
		assertEquals("x", checkNotNull("x"));
		try {
			checkNotNull(null, "Missing %s", "value");
			fail();
		} catch (NullPointerException e) {
			assertEquals("Missing value", e.getMessage());
		}
	}

	@Test
	public void testCheckArgumentFormatsMessage() {
		checkArgument(true, "Never formatted %s", new Object() {
			@Override
			public String toString() {
				throw new AssertionError();
			}
		});
		try {
			checkArgument(false, "Position %s exceeds %s", 7, 5);
			fail();
		} catch (IllegalArgumentException e) {
			assertEquals("Position 7 exceeds 5", e.getMessage());
		}
	}

	@Test
	public void testCheckArgumentSupplierIsLazy() {
		checkArgument(true, () -> {
			throw new AssertionError();
		});
		try {
			checkArgument(false, () -> "lazy");
			fail();
		} catch (IllegalArgumentException e) {
			assertEquals("lazy", e.getMessage());
		}
	}

	@Test(expected = IllegalStateException.class)
	public void testCheckState() {
		checkState(false, "State %s", "broken");
	}
}
