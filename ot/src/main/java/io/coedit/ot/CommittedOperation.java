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

import static io.coedit.util.Preconditions.checkNotNull;

/**
 * An operation as it was accepted into a document: expressed against the revision
 * preceding {@link #getRevision()} and tagged with the client that submitted it.
 */
public final class CommittedOperation {
	private final long revision;
	private final TextOp operation;
	private final String clientId;

	public CommittedOperation(long revision, @NotNull TextOp operation, @NotNull String clientId) {
		this.revision = revision;
		this.operation = checkNotNull(operation);
		this.clientId = checkNotNull(clientId);
	}

	public long getRevision() {
		return revision;
	}

	public TextOp getOperation() {
		return operation;
	}

	public OpId getOpId() {
		return operation.getId();
	}

	public String getClientId() {
		return clientId;
	}

	@Override
	public String toString() {
		return "CommittedOperation{revision=" + revision + ", operation=" + operation + ", client=" + clientId + '}';
	}
}
