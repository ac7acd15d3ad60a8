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

package io.coedit.ot;

import org.junit.Test;

import java.util.EnumSet;

import static io.coedit.test.TestUtils.assertThrows;
import static org.junit.Assert.*;

public final class AccessControlListTest {
	@Test
	public void testOwnerHoldsEveryCapability() {
		AccessControlList acl = AccessControlList.create("alice");
		assertEquals(EnumSet.allOf(Capability.class), acl.getCapabilities("alice"));
		assertTrue(acl.hasCapability("alice", Capability.COMMENT));
		assertTrue(acl.getCapabilities("bob").isEmpty());
	}

	@Test
	public void testGrantAndRevoke() {
		AccessControlList acl = AccessControlList.create("alice")
				.grant("bob", Capability.READ)
				.grant("bob", Capability.WRITE);
		assertEquals(EnumSet.of(Capability.READ, Capability.WRITE), acl.getCapabilities("bob"));

		acl.revoke("bob", Capability.WRITE);
		assertFalse(acl.hasCapability("bob", Capability.WRITE));
		assertTrue(acl.hasCapability("bob", Capability.READ));

		acl.revokeAll("bob");
		assertTrue(acl.getCapabilities("bob").isEmpty());
	}

	@Test
	public void testOwnerCannotBeRevoked() {
		AccessControlList acl = AccessControlList.create("alice");
		assertThrows(IllegalArgumentException.class, () -> acl.revoke("alice", Capability.WRITE));
		assertThrows(IllegalArgumentException.class, () -> acl.revokeAll("alice"));
		assertThrows(IllegalArgumentException.class, () -> acl.grant("bob"));
	}
}
