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

import io.coedit.ot.TextOp;
import org.jetbrains.annotations.NotNull;

import static io.coedit.util.Preconditions.checkArgument;
import static io.coedit.util.Preconditions.checkNotNull;

/**
 * Inbound request of a client to apply an operation composed against {@code baseRevision}.
 */
public final class SubmitMessage {
	private final String clientId;
	private final TextOp operation;
	private final long baseRevision;

	public SubmitMessage(@NotNull String clientId, @NotNull TextOp operation, long baseRevision) {
		checkArgument(baseRevision >= 0, "Base revision cannot be negative");
		this.clientId = checkNotNull(clientId);
		this.operation = checkNotNull(operation);
		this.baseRevision = baseRevision;
	}

	public static SubmitMessage of(@NotNull String clientId, @NotNull TextOp operation) {
		return new SubmitMessage(clientId, operation, operation.getBaseRevision());
	}

	public String getClientId() {
		return clientId;
	}

	/**
	 * The operation re-based on {@link #getBaseRevision()}.
	 */
	public TextOp getOperation() {
		return operation.getBaseRevision() == baseRevision ? operation : operation.withBaseRevision(baseRevision);
	}

	public long getBaseRevision() {
		return baseRevision;
	}

	@Override
	public String toString() {
		return "SubmitMessage{client=" + clientId + ", operation=" + operation + ", base=" + baseRevision + '}';
	}
}
