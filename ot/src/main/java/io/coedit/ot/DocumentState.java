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

import io.coedit.ot.exceptions.MalformedOperationException;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Materialized text plus the revision log it was built from.
 * <p>
 * Content is always the result of replaying the log onto the empty text,
 * or onto the snapshot the document was restored from.
 * Mutated only by {@link SyncController} inside its commit section.
 */
public final class DocumentState {
	private final TextState content;
	private final RevisionLog<TextOp> log;
	private final DocumentSnapshot base;

	private DocumentState(DocumentSnapshot base) {
		this.base = base;
		this.content = new TextState(base.getContent());
		this.log = RevisionLog.create(base.getRevision());
	}

	public static DocumentState create() {
		return new DocumentState(DocumentSnapshot.EMPTY);
	}

	/**
	 * Rebuilds a document from a persisted snapshot and the operations committed after it.
	 */
	public static DocumentState restore(@NotNull DocumentSnapshot snapshot, @NotNull List<? extends TextOp> appendedSince)
			throws MalformedOperationException {
		DocumentState state = new DocumentState(snapshot);
		for (TextOp op : appendedSince) {
			state.commit(op);
		}
		return state;
	}

	public static DocumentState replay(@NotNull List<? extends TextOp> history) throws MalformedOperationException {
		return restore(DocumentSnapshot.EMPTY, history);
	}

	/**
	 * Appends the operation to the log and applies it to the content.
	 *
	 * @return the new revision
	 * @throws MalformedOperationException if the operation does not fit the current content,
	 *                                     in which case nothing is changed
	 */
	synchronized long commit(TextOp op) throws MalformedOperationException {
		content.validate(op);
		content.apply(op);
		return log.append(op);
	}

	public synchronized long getRevision() {
		return log.getRevision();
	}

	public synchronized String getContent() {
		return content.getText();
	}

	public synchronized int getLength() {
		return content.length();
	}

	/**
	 * Length of the content at the given revision, derived by walking back
	 * from the current content through the operations committed since.
	 */
	public synchronized int lengthAt(long revision) {
		long length = content.length();
		for (TextOp op : log.entriesSince(revision)) {
			length += op.getKind() == OpKind.INSERT ? -op.getLength() : op.getLength();
		}
		return (int) length;
	}

	public synchronized DocumentSnapshot snapshot() {
		return DocumentSnapshot.of(log.getRevision(), content.getText());
	}

	/**
	 * Reconstructs the content at the given revision by replaying the log.
	 */
	public String contentAt(long revision) {
		TextState state = new TextState(base.getContent());
		return log.replayOnto(state, base.getRevision(), revision).getText();
	}

	public RevisionLog<TextOp> getLog() {
		return log;
	}

	@Override
	public synchronized String toString() {
		return "DocumentState{revision=" + log.getRevision() + ", length=" + content.length() + '}';
	}
}
