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
import io.coedit.ot.exceptions.UnauthorizedException;
import io.coedit.ot.messages.AckMessage;
import io.coedit.ot.messages.BroadcastMessage;
import io.coedit.ot.messages.RejectMessage;
import io.coedit.util.ApplicationSettings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import static io.coedit.util.Preconditions.checkArgument;
import static io.coedit.util.Preconditions.checkState;
import static java.lang.Math.max;

/**
 * Per-client context of a document: the client's view of the text, its
 * unacknowledged edits and its cursor.
 * <p>
 * The view always equals the document at {@link #getAckedRevision()} with the pending
 * operations applied on top. Only the first pending operation is in flight at a time;
 * each following one is forwarded once its predecessor is acknowledged, re-based on
 * the acknowledged revision.
 * <p>
 * Committed operations reach the session only through its {@link SessionMailbox}, which
 * hands them over one at a time in revision order. Each one is either the acknowledgement
 * of the in-flight edit or a remote operation to be rewritten through the pending edits.
 * <p>
 * All state is guarded by the session's monitor. A caller that composes an edit from
 * {@link #getText()} or {@link #getCursor()} must hold that monitor across reading the
 * view and calling {@link #submitLocalEdit(TextOp)}, otherwise a delivery may move the
 * view in between; {@link #edit(Function)} does this on the caller's behalf.
 */
public final class Session {
	private static final Logger logger = LoggerFactory.getLogger(Session.class);

	public static final int MAX_PENDING_OPS = ApplicationSettings.getInt(Session.class, "maxPendingOps", 1000);

	private final String clientId;
	private final Set<Capability> capabilities;
	private final SyncController controller;
	private final OTSystem<TextOp> otSystem;
	private final ClientChannel channel;
	private final SessionMailbox mailbox;
	private final AtomicLong sequence = new AtomicLong();

	private final TextState view;
	private final List<TextOp> pendingOps = new ArrayList<>();
	private boolean inFlight;
	private long ackedRevision;
	private Cursor cursor = Cursor.ZERO;

	private volatile boolean open = true;

	Session(String clientId, Set<Capability> capabilities, SyncController controller, OTSystem<TextOp> otSystem,
			ClientChannel channel, Executor deliveryExecutor, DocumentSnapshot snapshot) {
		this.clientId = clientId;
		this.capabilities = capabilities.isEmpty() ?
				Collections.emptySet() :
				Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
		this.controller = controller;
		this.otSystem = otSystem;
		this.channel = channel;
		this.view = new TextState(snapshot.getContent());
		this.ackedRevision = snapshot.getRevision();
		this.mailbox = new SessionMailbox(clientId, deliveryExecutor, this::deliver, this::fail);
	}

	// region local edits
	public OpId nextOpId() {
		return OpId.of(clientId, sequence.incrementAndGet());
	}

	public InsertOp insert(int position, @NotNull String text) throws CollabException {
		InsertOp op = InsertOp.of(nextOpId(), position, text, getAckedRevision());
		submitLocalEdit(op);
		return op;
	}

	public DeleteOp delete(int position, int length) throws CollabException {
		DeleteOp op = DeleteOp.of(nextOpId(), position, length, getAckedRevision());
		submitLocalEdit(op);
		return op;
	}

	/**
	 * Applies an edit composed against the current view, then hands it to the
	 * sync controller, right away or once the edits before it are acknowledged.
	 * <p>
	 * Rejections by the controller are not thrown but reported through the
	 * {@link ClientChannel}, after which the view is resynced from the document.
	 *
	 * @throws UnauthorizedException                                 if the client has no write capability
	 * @throws io.coedit.ot.exceptions.MalformedOperationException if the edit does not fit the view
	 */
	public void submitLocalEdit(@NotNull TextOp op) throws CollabException {
		checkArgument(op.getAuthorId().equals(clientId), "Operation %s is not authored by %s", op.getId(), clientId);
		TextOp toSend;
		synchronized (this) {
			checkState(open, "Session %s is closed", clientId);
			if (!capabilities.contains(Capability.WRITE)) {
				throw new UnauthorizedException(op.getId(), "Client " + clientId + " has no write access");
			}
			view.validate(op);
			checkState(pendingOps.size() < MAX_PENDING_OPS, "Too many pending operations for %s", clientId);
			view.apply(op);
			cursor = cursor.transform(op, true);
			pendingOps.add(op);
			toSend = takeNextToSend();
		}
		if (toSend != null) {
			forward(toSend);
		}
	}

	/**
	 * Composes an edit against the current view and submits it while holding the
	 * session's monitor, so no delivery can change the view in between.
	 *
	 * @param composer receives the current view and returns the edit to apply,
	 *                 or {@code null} to submit nothing
	 * @return the submitted edit, or {@code null}
	 */
	@Nullable
	public TextOp edit(@NotNull Function<? super String, ? extends TextOp> composer) throws CollabException {
		synchronized (this) {
			TextOp op = composer.apply(view.getText());
			if (op != null) {
				submitLocalEdit(op);
			}
			return op;
		}
	}

	public synchronized void moveCursor(int position, int anchor) {
		checkArgument(position <= view.length() && anchor <= view.length(),
				"Cursor [%s..%s] is out of text of length %s", anchor, position, view.length());
		cursor = Cursor.of(position, anchor);
	}

	public void moveCursor(int position) {
		moveCursor(position, position);
	}

	/**
	 * Drops every pending edit and reloads the view from the current document snapshot.
	 */
	public synchronized DocumentSnapshot resync() {
		DocumentSnapshot snapshot = controller.snapshot();
		if (!pendingOps.isEmpty()) {
			logger.debug("Dropping {} pending operations of {} on resync", pendingOps.size(), clientId);
		}
		pendingOps.clear();
		inFlight = false;
		view.reset(snapshot.getContent());
		ackedRevision = max(ackedRevision, snapshot.getRevision());
		cursor = cursor.clamp(view.length());
		return snapshot;
	}

	public void close() {
		controller.disconnect(this);
	}
	// endregion

	// region controller callbacks
	void enqueue(CommittedOperation committed) {
		mailbox.enqueue(committed);
	}

	void flush() {
		mailbox.flush();
	}

	void reject(CollabException e) {
		synchronized (this) {
			if (!open) return;
			if (e.getOpId() != null && indexOfPending(e.getOpId()) != -1) {
				logger.debug("Operation {} of {} rejected: {}", e.getOpId(), clientId, e.getReason());
				resync();
			}
		}
		channel.onReject(RejectMessage.of(e));
	}

	void onClosed() {
		synchronized (this) {
			open = false;
			pendingOps.clear();
			inFlight = false;
		}
		mailbox.close();
	}

	private void deliver(CommittedOperation committed) {
		boolean own;
		TextOp toSend;
		synchronized (this) {
			if (!open || committed.getRevision() <= ackedRevision) return;
			checkState(committed.getRevision() == ackedRevision + 1,
					"Session %s at revision %s received revision %s", clientId, ackedRevision, committed.getRevision());
			own = committed.getClientId().equals(clientId);
			if (own && isInFlight(committed.getOpId())) {
				onAck(committed.getOpId());
			} else {
				onRemoteOperation(committed.getOperation(), own);
			}
			ackedRevision = committed.getRevision();
			toSend = takeNextToSend();
		}
		if (own) {
			channel.onAck(new AckMessage(committed.getOpId(), committed.getRevision()));
		} else {
			channel.onBroadcast(BroadcastMessage.of(committed));
		}
		if (toSend != null) {
			forward(toSend);
		}
	}

	/**
	 * Rewrites a committed operation through the pending edits and applies it to the view,
	 * rewriting each pending edit in turn so it stays applicable after the remote one.
	 */
	private void onRemoteOperation(TextOp op, boolean own) {
		TextOp remote = op;
		for (int i = 0; i < pendingOps.size(); i++) {
			TextOp pending = pendingOps.get(i);
			pendingOps.set(i, otSystem.transform(pending, remote));
			remote = otSystem.transform(remote, pending);
		}
		view.apply(remote);
		cursor = cursor.transform(remote, own);
	}

	private void onAck(OpId opId) {
		int idx = indexOfPending(opId);
		checkState(idx == 0, "Acknowledged operation %s is not the first pending one", opId);
		pendingOps.remove(0);
		inFlight = false;
	}

	private void fail(Throwable e) {
		logger.warn("Disconnecting {} after delivery failure", clientId, e);
		close();
	}
	// endregion

	@Nullable
	private TextOp takeNextToSend() {
		if (inFlight || pendingOps.isEmpty()) return null;
		inFlight = true;
		return pendingOps.get(0).withBaseRevision(ackedRevision);
	}

	private void forward(TextOp op) {
		try {
			controller.submit(clientId, op);
		} catch (CollabException e) {
			reject(e);
		}
	}

	private boolean isInFlight(OpId opId) {
		return inFlight && pendingOps.get(0).getId().equals(opId);
	}

	private int indexOfPending(OpId opId) {
		for (int i = 0; i < pendingOps.size(); i++) {
			if (pendingOps.get(i).getId().equals(opId)) {
				return i;
			}
		}
		return -1;
	}

	// region getters
	public String getClientId() {
		return clientId;
	}

	public Set<Capability> getCapabilities() {
		return capabilities;
	}

	public boolean hasCapability(Capability capability) {
		return capabilities.contains(capability);
	}

	public boolean isOpen() {
		return open;
	}

	public synchronized long getAckedRevision() {
		return ackedRevision;
	}

	public synchronized String getText() {
		return view.getText();
	}

	public synchronized Cursor getCursor() {
		return cursor;
	}

	/**
	 * Returns the unacknowledged edits in submission order. They keep the base revision
	 * they were composed against; the first one is re-based on the acknowledged revision
	 * only when it is forwarded to the controller.
	 */
	public synchronized List<TextOp> getPendingOps() {
		return new ArrayList<>(pendingOps);
	}

	public synchronized boolean hasPendingOps() {
		return !pendingOps.isEmpty();
	}

	/**
	 * Whether every committed operation addressed to this session has been consumed.
	 */
	public boolean isSettled() {
		return mailbox.isIdle() && !hasPendingOps();
	}
	// endregion

	@Override
	public synchronized String toString() {
		return "Session{" + clientId +
				" acked=" + ackedRevision +
				" pending=" + pendingOps.size() +
				" cursor=" + cursor +
				(open ? "" : " closed") +
				'}';
	}
}
