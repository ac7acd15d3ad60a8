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

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static io.coedit.util.Preconditions.checkArgument;
import static io.coedit.util.Preconditions.checkNotNull;

/**
 * In-memory per-document grants. The owner always holds every capability.
 */
public final class AccessControlList implements PermissionChecker {
	private final String ownerId;
	private final Map<String, Set<Capability>> grants = new ConcurrentHashMap<>();

	private AccessControlList(String ownerId) {
		this.ownerId = ownerId;
	}

	public static AccessControlList create(@NotNull String ownerId) {
		return new AccessControlList(checkNotNull(ownerId));
	}

	public AccessControlList grant(@NotNull String clientId, Capability... capabilities) {
		checkNotNull(clientId);
		checkArgument(capabilities.length > 0, "No capabilities to grant");
		grants.compute(clientId, (id, existing) -> {
			Set<Capability> updated = existing == null ? EnumSet.noneOf(Capability.class) : EnumSet.copyOf(existing);
			Collections.addAll(updated, capabilities);
			return updated;
		});
		return this;
	}

	public AccessControlList revoke(@NotNull String clientId, Capability capability) {
		checkArgument(!clientId.equals(ownerId), "Cannot revoke capabilities of the owner");
		grants.computeIfPresent(clientId, (id, existing) -> {
			Set<Capability> updated = EnumSet.copyOf(existing);
			updated.remove(capability);
			return updated.isEmpty() ? null : updated;
		});
		return this;
	}

	public AccessControlList revokeAll(@NotNull String clientId) {
		checkArgument(!clientId.equals(ownerId), "Cannot revoke capabilities of the owner");
		grants.remove(clientId);
		return this;
	}

	public String getOwnerId() {
		return ownerId;
	}

	public Set<Capability> getCapabilities(String clientId) {
		if (clientId.equals(ownerId)) {
			return Collections.unmodifiableSet(EnumSet.allOf(Capability.class));
		}
		Set<Capability> granted = grants.get(clientId);
		return granted == null ? Collections.emptySet() : Collections.unmodifiableSet(granted);
	}

	@Override
	public boolean hasCapability(String clientId, Capability capability) {
		return getCapabilities(clientId).contains(capability);
	}

	@Override
	public String toString() {
		return "AccessControlList{owner=" + ownerId + ", grants=" + grants + '}';
	}
}
