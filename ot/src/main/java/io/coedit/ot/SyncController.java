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
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static io.coedit.util.Preconditions.checkNotNull;
import static io.coedit.util.Preconditions.checkState;

/**
 * Single writer of a document: validates submitted operations, rewrites them against
 * everything committed since their base revision, commits them and fans the result out
 * to every connected session.
 * <p>
 * Transformation runs outside of the commit lock. Under the lock the revision is checked
 * again and the operation is rewritten through whatever was committed in between, so
 * revisions are assigned strictly in commit order.
 */
public final class SyncController {
	private static final Logger logger = LoggerFactory.getLogger(SyncController.class);

	public enum Stage {
		IDLE, VALIDATING, TRANSFORMING, COMMITTING, BROADCASTING
	}

	private final String documentId;
	private final DocumentState document;
	private final OTSystem<TextOp> otSystem;
	private final PermissionChecker permissions;
	private final Executor deliveryExecutor;

	private final Map<String, Session> sessions = new ConcurrentHashMap<>();
	private final Lock commitLock = new ReentrantLock();

	// region stats
	private final AtomicLong committed = new AtomicLong();
	private final AtomicLong rejected = new AtomicLong();
	private final AtomicLong retransforms = new AtomicLong();
	// endregion

	private SyncController(String documentId, DocumentState document, OTSystem<TextOp> otSystem,
			PermissionChecker permissions, Executor deliveryExecutor) {
		this.documentId = documentId;
		this.document = document;
		this.otSystem = otSystem;
		this.permissions = permissions;
		this.deliveryExecutor = deliveryExecutor;
	}

	public static SyncController create(@NotNull String documentId, @NotNull DocumentState document,
			@NotNull OTSystem<TextOp> otSystem, @NotNull PermissionChecker permissions, @NotNull Executor deliveryExecutor) {
		return new SyncController(checkNotNull(documentId), checkNotNull(document), checkNotNull(otSystem),
				checkNotNull(permissions), checkNotNull(deliveryExecutor));
	}

	// region sessions
	public Session connect(@NotNull String clientId, @NotNull Set<Capability> capabilities, @NotNull ClientChannel channel) {
		checkNotNull(clientId);
		checkNotNull(channel);
		commitLock.lock();
		try {
			checkState(!sessions.containsKey(clientId), "Client %s is already connected to %s", clientId, documentId);
			Session session = new Session(clientId, capabilities, this, otSystem, channel, deliveryExecutor, document.snapshot());
			sessions.put(clientId, session);
			logger.info("{} joined {} at revision {}", clientId, documentId, session.getAckedRevision());
			return session;
		} finally {
			commitLock.unlock();
		}
	}

	/**
	 * Removes the session. Its mailbox is closed and nothing more is delivered to it;
	 * an operation of this client that is being processed concurrently is dropped.
	 */
	public boolean disconnect(@NotNull Session session) {
		boolean removed = sessions.remove(session.getClientId(), session);
		session.onClosed();
		if (removed) {
			logger.info("{} left {}", session.getClientId(), documentId);
		}
		return removed;
	}

	@Nullable
	public Session getSession(String clientId) {
		return sessions.get(clientId);
	}

	public Collection<Session> getSessions() {
		return Collections.unmodifiableCollection(new ArrayList<>(sessions.values()));
	}
	// endregion

	/**
	 * Runs one submission through validation, transformation, commit and broadcast.
	 *
	 * @param clientId the submitting client
	 * @param op       an operation composed against {@link TextOp#getBaseRevision()}
	 * @return the committed operation, or {@code null} if the client disconnected while
	 * the operation was being processed
	 * @throws StaleRevisionException      if the base revision is unknown to the log
	 * @throws UnauthorizedException       if the client may not edit the document
	 * @throws MalformedOperationException if the operation does not fit the document at its base revision,
	 *                                     or the rewritten operation does not fit the current one
	 */
	@Nullable
	public CommittedOperation submit(@NotNull String clientId, @NotNull TextOp op) throws CollabException {
		Cycle cycle = new Cycle(op.getId());
		try {
			cycle.moveTo(Stage.VALIDATING);
			Session session = validate(clientId, op);

			cycle.moveTo(Stage.TRANSFORMING);
			RevisionLog<TextOp> log = document.getLog();
			List<TextOp> concurrent = log.entriesSince(op.getBaseRevision());
			TextOp transformed = otSystem.transform(op, concurrent);
			long seenRevision = op.getBaseRevision() + concurrent.size();

			CommittedOperation result;
			commitLock.lock();
			try {
				cycle.moveTo(Stage.COMMITTING);
				long revision = document.getRevision();
				if (revision != seenRevision) {
					retransforms.incrementAndGet();
					logger.trace("Rewriting {} through revisions ({}, {}]", op.getId(), seenRevision, revision);
					transformed = otSystem.transform(transformed, log.entriesSince(seenRevision));
				}
				if (sessions.get(clientId) != session) {
					logger.debug("Dropping {} of disconnected client {}", op.getId(), clientId);
					return null;
				}
				long newRevision = document.commit(transformed.withBaseRevision(revision));
				result = new CommittedOperation(newRevision, log.get(newRevision), clientId);
				committed.incrementAndGet();

				cycle.moveTo(Stage.BROADCASTING);
				for (Session target : sessions.values()) {
					target.enqueue(result);
				}
			} finally {
				commitLock.unlock();
			}
			for (Session target : sessions.values()) {
				target.flush();
			}
			logger.trace("Committed {} as revision {}", op.getId(), result.getRevision());
			return result;
		} catch (CollabException e) {
			rejected.incrementAndGet();
			if (e instanceof MalformedOperationException) {
				logger.warn("Rejected {} from {}: {}", op.getId(), clientId, e.getMessage());
			} else {
				logger.debug("Rejected {} from {}: {}", op.getId(), clientId, e.getMessage());
			}
			throw e;
		} finally {
			cycle.moveTo(Stage.IDLE);
		}
	}

	private Session validate(String clientId, TextOp op) throws CollabException {
		Session session = sessions.get(clientId);
		if (session == null) {
			throw new UnauthorizedException(op.getId(), "Client " + clientId + " is not connected to " + documentId);
		}
		if (!op.getAuthorId().equals(clientId)) {
			throw new UnauthorizedException(op.getId(), "Client " + clientId + " cannot submit operations of " + op.getAuthorId());
		}
		if (!permissions.hasCapability(clientId, Capability.WRITE)) {
			throw new UnauthorizedException(op.getId(), "Client " + clientId + " has no write access to " + documentId);
		}
		RevisionLog<TextOp> log = document.getLog();
		long base = op.getBaseRevision();
		long revision = log.getRevision();
		if (base > revision || base < log.getStartRevision()) {
			throw new StaleRevisionException(op.getId(),
					"Base revision " + base + " is outside of [" + log.getStartRevision() + ", " + revision + "]");
		}
		int baseLength = document.lengthAt(base);
		if (!op.fits(baseLength)) {
			throw new MalformedOperationException(op.getId(),
					"Operation " + op + " is out of bounds of text of length " + baseLength + " at revision " + base);
		}
		return session;
	}

	// region document
	public DocumentSnapshot snapshot() {
		return document.snapshot();
	}

	/**
	 * Returns the committed operations after the given revision, for a client catching up.
	 */
	public List<CommittedOperation> appendedSince(long revision) throws StaleRevisionException {
		RevisionLog<TextOp> log = document.getLog();
		if (!log.contains(revision)) {
			throw new StaleRevisionException(null,
					"Revision " + revision + " is outside of [" + log.getStartRevision() + ", " + log.getRevision() + "]");
		}
		List<TextOp> ops = log.entriesSince(revision);
		List<CommittedOperation> result = new ArrayList<>(ops.size());
		for (int i = 0; i < ops.size(); i++) {
			TextOp op = ops.get(i);
			result.add(new CommittedOperation(revision + i + 1, op, op.getAuthorId()));
		}
		return result;
	}

	public String getDocumentId() {
		return documentId;
	}

	public PermissionChecker getPermissions() {
		return permissions;
	}

	public DocumentState getDocument() {
		return document;
	}

	public long getRevision() {
		return document.getRevision();
	}
	// endregion

	// region counters
	public long getCommittedCount() {
		return committed.get();
	}

	public long getRejectedCount() {
		return rejected.get();
	}

	public long getRetransformCount() {
		return retransforms.get();
	}
	// endregion

	@Override
	public String toString() {
		return "SyncController{" + documentId +
				", revision=" + document.getRevision() +
				", sessions=" + sessions.size() +
				", committed=" + committed.get() +
				", rejected=" + rejected.get() +
				'}';
	}

	private static final class Cycle {
		private final OpId opId;
		private Stage stage = Stage.IDLE;

		Cycle(OpId opId) {
			this.opId = opId;
		}

		void moveTo(Stage next) {
			checkState(next == Stage.IDLE || next.ordinal() == stage.ordinal() + 1,
					"Illegal transition of %s from %s to %s", opId, stage, next);
			logger.trace("{}: {} -> {}", opId, stage, next);
			stage = next;
		}
	}
}
