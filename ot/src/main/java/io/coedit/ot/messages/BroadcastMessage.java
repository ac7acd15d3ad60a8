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

package io.coedit.ot.messages;

import io.coedit.ot.CommittedOperation;
import io.coedit.ot.TextOp;
import org.jetbrains.annotations.NotNull;

import static io.coedit.util.Preconditions.checkNotNull;

/**
 * An operation committed by another client, expressed against {@code revision - 1}.
 */
public final class BroadcastMessage {
	private final long revision;
	private final TextOp operation;
	private final String authorId;

	public BroadcastMessage(long revision, @NotNull TextOp operation, @NotNull String authorId) {
		this.revision = revision;
		this.operation = checkNotNull(operation);
		this.authorId = checkNotNull(authorId);
	}

	public static BroadcastMessage of(CommittedOperation committed) {
		return new BroadcastMessage(committed.getRevision(), committed.getOperation(), committed.getOperation().getAuthorId());
	}

	public long getRevision() {
		return revision;
	}

	public TextOp getOperation() {
		return operation;
	}

	public String getAuthorId() {
		return authorId;
	}

	@Override
	public String toString() {
		return "BroadcastMessage{revision=" + revision + ", operation=" + operation + ", author=" + authorId + '}';
	}
}
