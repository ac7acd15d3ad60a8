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

import static io.coedit.util.Preconditions.checkArgument;
import static io.coedit.util.Preconditions.checkNotNull;

/**
 * Globally unique operation id: the author id plus a per-author sequence number.
 */
public final class OpId implements Comparable<OpId> {
	private static final char SEPARATOR = '#';

	private final String authorId;
	private final long sequence;

	private OpId(String authorId, long sequence) {
		this.authorId = authorId;
		this.sequence = sequence;
	}

	public static OpId of(@NotNull String authorId, long sequence) {
		checkNotNull(authorId, "Author id is required");
		checkArgument(!authorId.isEmpty(), "Author id cannot be empty");
		checkArgument(sequence >= 0, "Sequence cannot be negative");
		return new OpId(authorId, sequence);
	}

	/**
	 * Parses the {@code author#sequence} form produced by {@link #toString()}.
	 */
	public static OpId parse(@NotNull String value) {
		int idx = value.lastIndexOf(SEPARATOR);
		checkArgument(idx > 0 && idx < value.length() - 1, "Malformed operation id: %s", value);
		long sequence;
		try {
			sequence = Long.parseLong(value.substring(idx + 1));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Malformed operation id: " + value, e);
		}
		return of(value.substring(0, idx), sequence);
	}

	public String getAuthorId() {
		return authorId;
	}

	public long getSequence() {
		return sequence;
	}

	/**
	 * Total order used to break ties between concurrent operations:
	 * by author id first, then by sequence.
	 */
	@Override
	public int compareTo(@NotNull OpId o) {
		int result = authorId.compareTo(o.authorId);
		return result != 0 ? result : Long.compare(sequence, o.sequence);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		OpId opId = (OpId) o;
		return sequence == opId.sequence && authorId.equals(opId.authorId);
	}

	@Override
	public int hashCode() {
		return 31 * authorId.hashCode() + Long.hashCode(sequence);
	}

	@Override
	public String toString() {
		return authorId + SEPARATOR + sequence;
	}
}
