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
import org.jetbrains.annotations.NotNull;

import static io.coedit.util.Preconditions.checkNotNull;

public final class AckMessage {
	private final OpId ackedOpId;
	private final long revision;

	public AckMessage(@NotNull OpId ackedOpId, long revision) {
		this.ackedOpId = checkNotNull(ackedOpId);
		this.revision = revision;
	}

	public OpId getAckedOpId() {
		return ackedOpId;
	}

	public long getRevision() {
		return revision;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AckMessage that = (AckMessage) o;
		return revision == that.revision && ackedOpId.equals(that.ackedOpId);
	}

	@Override
	public int hashCode() {
		return 31 * ackedOpId.hashCode() + Long.hashCode(revision);
	}

	@Override
	public String toString() {
		return "AckMessage{op=" + ackedOpId + ", revision=" + revision + '}';
	}
}
