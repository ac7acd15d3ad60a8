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

import io.coedit.ot.exceptions.CollabException;
import io.coedit.ot.exceptions.MalformedOperationException;
import io.coedit.ot.exceptions.StaleRevisionException;
import io.coedit.ot.exceptions.UnauthorizedException;
import io.coedit.ot.json.MessageJson;
import io.coedit.ot.messages.SubmitMessage;
import io.coedit.util.ApplicationSettings;
import io.coedit.util.SimpleThreadFactory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static io.coedit.util.Preconditions.checkArgument;
import static io.coedit.util.Preconditions.checkNotNull;
import static io.coedit.util.Preconditions.checkState;

/**
 * Registry of hosted documents. Each document gets its own {@link SyncController},
 * so edits of independent documents commit concurrently.
 */
public final class CollaborationService implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(CollaborationService.class);

	public static final int DELIVERY_THREADS = ApplicationSettings.getInt(CollaborationService.class, "deliveryThreads", 4);

	private final Map<String, CollabDocument> documents = new ConcurrentHashMap<>();

	private OTSystem<TextOp> otSystem = TextOT.create();
	private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();
	@Nullable
	private PermissionChecker permissionChecker;
	@Nullable
	private Executor executor;
	@Nullable
	private ExecutorService ownedExecutor;

	private volatile boolean closed;

	private CollaborationService() {
	}

	public static CollaborationService create() {
		return new CollaborationService();
	}

	/**
	 * Runs session deliveries on the given executor, which stays owned by the caller.
	 */
	public CollaborationService withExecutor(@NotNull Executor executor) {
		checkState(documents.isEmpty(), "Executor must be set before documents are created");
		this.executor = checkNotNull(executor);
		return this;
	}

	/**
	 * Adds an external permission source, consulted in addition to each document's access list.
	 */
	public CollaborationService withPermissionChecker(@NotNull PermissionChecker permissionChecker) {
		this.permissionChecker = checkNotNull(permissionChecker);
		return this;
	}

	public CollaborationService withIdGenerator(@NotNull Supplier<String> idGenerator) {
		this.idGenerator = checkNotNull(idGenerator);
		return this;
	}

	public CollaborationService withOTSystem(@NotNull OTSystem<TextOp> otSystem) {
		this.otSystem = checkNotNull(otSystem);
		return this;
	}

	// region documents
	public String createDocument(@NotNull String title, @NotNull String ownerId) {
		return register(checkNotNull(title), checkNotNull(ownerId), DocumentState.create());
	}

	/**
	 * Hosts a document rebuilt from a persisted snapshot and the operations committed after it.
	 */
	public String restoreDocument(@NotNull String title, @NotNull String ownerId,
			@NotNull DocumentSnapshot snapshot, @NotNull List<? extends TextOp> appendedSince) throws MalformedOperationException {
		return register(checkNotNull(title), checkNotNull(ownerId), DocumentState.restore(snapshot, appendedSince));
	}

	private String register(String title, String ownerId, DocumentState state) {
		checkState(!closed, "Service is closed");
		String id = idGenerator.get();
		AccessControlList acl = AccessControlList.create(ownerId);
		SyncController controller = SyncController.create(id, state, otSystem, permissionsOf(acl), getExecutor());
		CollabDocument document = new CollabDocument(id, title, ownerId, Instant.now(), acl, controller);
		checkState(documents.putIfAbsent(id, document) == null, "Duplicate document id %s", id);
		logger.info("Created document {} '{}' owned by {} at revision {}", id, title, ownerId, state.getRevision());
		return id;
	}

	private PermissionChecker permissionsOf(AccessControlList acl) {
		PermissionChecker external = this.permissionChecker;
		if (external == null) {
			return acl;
		}
		return (clientId, capability) -> acl.hasCapability(clientId, capability) || external.hasCapability(clientId, capability);
	}

	/**
	 * Disconnects every session of the document and removes it from the registry.
	 *
	 * @return the final snapshot of the document
	 */
	public DocumentSnapshot closeDocument(@NotNull String documentId) {
		CollabDocument document = documents.remove(documentId);
		checkArgument(document != null, "Unknown document %s", documentId);
		return close(document);
	}

	private DocumentSnapshot close(CollabDocument document) {
		for (Session session : document.getController().getSessions()) {
			session.close();
		}
		DocumentSnapshot snapshot = document.getController().snapshot();
		logger.info("Closed document {} at revision {}", document.getId(), snapshot.getRevision());
		return snapshot;
	}

	public CollabDocument getDocument(@NotNull String documentId) {
		CollabDocument document = documents.get(documentId);
		checkArgument(document != null, "Unknown document %s", documentId);
		return document;
	}

	public boolean hasDocument(String documentId) {
		return documents.containsKey(documentId);
	}

	public Collection<CollabDocument> getDocuments() {
		return Collections.unmodifiableCollection(new ArrayList<>(documents.values()));
	}

	public AccessControlList grant(@NotNull String documentId, @NotNull String clientId, Capability... capabilities) {
		return getDocument(documentId).getAcl().grant(clientId, capabilities);
	}
	// endregion

	// region sessions
	/**
	 * Joins a client to a document with the capabilities it currently holds.
	 *
	 * @throws UnauthorizedException if the client may not read the document
	 */
	public Session connect(@NotNull String documentId, @NotNull String clientId, @NotNull ClientChannel channel)
			throws UnauthorizedException {
		SyncController controller = getDocument(documentId).getController();
		Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
		for (Capability capability : Capability.values()) {
			if (controller.getPermissions().hasCapability(clientId, capability)) {
				capabilities.add(capability);
			}
		}
		if (!capabilities.contains(Capability.READ)) {
			throw new UnauthorizedException(null, "Client " + clientId + " has no read access to " + documentId);
		}
		return controller.connect(clientId, capabilities, channel);
	}

	public boolean disconnect(@NotNull String documentId, @NotNull String clientId) {
		SyncController controller = getDocument(documentId).getController();
		Session session = controller.getSession(clientId);
		return session != null && controller.disconnect(session);
	}

	/**
	 * Handles a submission arriving from the transport. Rejections are reported to the
	 * client through its channel rather than thrown.
	 *
	 * @return the committed operation, or {@code null} if it was rejected or dropped
	 * @throws UnauthorizedException if the submitting client is not connected
	 */
	@Nullable
	public CommittedOperation receive(@NotNull String documentId, @NotNull SubmitMessage message) throws UnauthorizedException {
		SyncController controller = getDocument(documentId).getController();
		Session session = controller.getSession(message.getClientId());
		if (session == null) {
			throw new UnauthorizedException(message.getOperation().getId(),
					"Client " + message.getClientId() + " is not connected to " + documentId);
		}
		try {
			return controller.submit(message.getClientId(), message.getOperation());
		} catch (CollabException e) {
			session.reject(e);
			return null;
		}
	}

	/**
	 * Decodes a JSON submission and handles it like {@link #receive(String, SubmitMessage)}.
	 *
	 * @throws MalformedOperationException if the text is not a well-formed submit message
	 */
	@Nullable
	public CommittedOperation receive(@NotNull String documentId, @NotNull String json) throws CollabException {
		return receive(documentId, MessageJson.decodeSubmit(json));
	}

	public List<ActiveUser> getActiveUsers(@NotNull String documentId) {
		List<ActiveUser> users = new ArrayList<>();
		for (Session session : getDocument(documentId).getController().getSessions()) {
			users.add(new ActiveUser(session.getClientId(), session.getCursor()));
		}
		users.sort((a, b) -> a.getClientId().compareTo(b.getClientId()));
		return users;
	}
	// endregion

	// region queries
	public String getContent(@NotNull String documentId) {
		return getDocument(documentId).getState().getContent();
	}

	public long getRevision(@NotNull String documentId) {
		return getDocument(documentId).getState().getRevision();
	}

	public DocumentSnapshot snapshot(@NotNull String documentId) {
		return getDocument(documentId).getController().snapshot();
	}

	public List<CommittedOperation> appendedSince(@NotNull String documentId, long revision) throws StaleRevisionException {
		return getDocument(documentId).getController().appendedSince(revision);
	}
	// endregion

	private synchronized Executor getExecutor() {
		if (executor == null) {
			ownedExecutor = Executors.newFixedThreadPool(DELIVERY_THREADS,
					SimpleThreadFactory.create("coedit-delivery-{}").withDaemon(true));
			executor = ownedExecutor;
		}
		return executor;
	}

	@Override
	public void close() {
		closed = true;
		for (String documentId : new ArrayList<>(documents.keySet())) {
			CollabDocument document = documents.remove(documentId);
			if (document != null) {
				close(document);
			}
		}
		synchronized (this) {
			if (ownedExecutor != null) {
				ownedExecutor.shutdown();
				ownedExecutor = null;
			}
		}
	}

	@Override
	public String toString() {
		return "CollaborationService{documents=" + documents.size() + (closed ? ", closed" : "") + '}';
	}
}
