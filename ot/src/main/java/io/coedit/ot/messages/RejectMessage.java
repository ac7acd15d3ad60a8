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

import io.coedit.ot.OpId;
import io.coedit.ot.exceptions.CollabException;
import io.coedit.ot.exceptions.RejectReason;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static io.coedit.util.Preconditions.checkNotNull;

public final class RejectMessage {
	@Nullable
	private final OpId opId;
	private final RejectReason reason;
	private final String message;

	public RejectMessage(@Nullable OpId opId, @NotNull RejectReason reason, @NotNull String message) {
		this.opId = opId;
		this.reason = checkNotNull(reason);
		this.message = checkNotNull(message);
	}

	public static RejectMessage of(CollabException e) {
		return new RejectMessage(e.getOpId(), e.getReason(), String.valueOf(e.getMessage()));
	}

	@Nullable
	public OpId getOpId() {
		return opId;
	}

	public RejectReason getReason() {
		return reason;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return "RejectMessage{op=" + opId + ", reason=" + reason + ", message='" + message + "'}";
	}
}
