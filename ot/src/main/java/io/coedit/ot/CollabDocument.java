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

import java.time.Instant;

/**
 * A document hosted by {@link CollaborationService} together with its metadata.
 */
public final class CollabDocument {
	private final String id;
	private final String title;
	private final String ownerId;
	private final Instant createdAt;
	private final AccessControlList acl;
	private final SyncController controller;

	CollabDocument(@NotNull String id, @NotNull String title, @NotNull String ownerId, @NotNull Instant createdAt,
			@NotNull AccessControlList acl, @NotNull SyncController controller) {
		this.id = id;
		this.title = title;
		this.ownerId = ownerId;
		this.createdAt = createdAt;
		this.acl = acl;
		this.controller = controller;
	}

	public String getId() {
		return id;
	}

	public String getTitle() {
		return title;
	}

	public String getOwnerId() {
		return ownerId;
	}

	public Instant getCreatedAt() {
		return createdAt;
	}

	public AccessControlList getAcl() {
		return acl;
	}

	public SyncController getController() {
		return controller;
	}

	public DocumentState getState() {
		return controller.getDocument();
	}

	@Override
	public String toString() {
		return "CollabDocument{" + id + " '" + title + "', owner=" + ownerId + ", revision=" + controller.getRevision() + '}';
	}
}
