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

package io.coedit.ot.exceptions;

import io.coedit.exception.StacklessException;
import io.coedit.ot.OpId;
import org.jetbrains.annotations.Nullable;

/**
 * Per-operation rejection. Never leaves the document or its log in a changed state.
 */
public abstract class CollabException extends StacklessException {
	@Nullable
	private final OpId opId;

	protected CollabException(@Nullable OpId opId, String message) {
		super(message);
		this.opId = opId;
	}

	protected CollabException(@Nullable OpId opId, String message, Throwable cause) {
		super(message, cause);
		this.opId = opId;
	}

	/**
	 * Id of the rejected operation, {@code null} when the request carried none.
	 */
	@Nullable
	public OpId getOpId() {
		return opId;
	}

	public abstract RejectReason getReason();
}
