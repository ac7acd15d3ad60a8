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

/**
 * Removes the range {@code [position, position + length)}.
 */
public final class DeleteOp extends TextOp {
	private final int length;

	private DeleteOp(OpId id, int position, int length, long baseRevision) {
		super(id, position, baseRevision);
		checkArgument(length >= 0, "Length cannot be negative: %s", length);
		this.length = length;
	}

	public static DeleteOp of(@NotNull OpId id, int position, int length, long baseRevision) {
		return new DeleteOp(id, position, length, baseRevision);
	}

	@Override
	public int getLength() {
		return length;
	}

	public int getEnd() {
		return getPosition() + length;
	}

	@Override
	public OpKind getKind() {
		return OpKind.DELETE;
	}

	@Override
	public DeleteOp withPosition(int position) {
		return new DeleteOp(getId(), position, length, getBaseRevision());
	}

	public DeleteOp withLength(int length) {
		return new DeleteOp(getId(), getPosition(), length, getBaseRevision());
	}

	public DeleteOp withRange(int position, int length) {
		return new DeleteOp(getId(), position, length, getBaseRevision());
	}

	@Override
	public DeleteOp withBaseRevision(long baseRevision) {
		return new DeleteOp(getId(), getPosition(), length, baseRevision);
	}

	@Override
	boolean fits(int textLength) {
		return getPosition() <= textLength && length <= textLength - getPosition();
	}

	@Override
	void applyTo(StringBuilder buffer) {
		buffer.delete(getPosition(), getEnd());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DeleteOp that = (DeleteOp) o;
		return getPosition() == that.getPosition() &&
				getBaseRevision() == that.getBaseRevision() &&
				length == that.length &&
				getId().equals(that.getId());
	}

	@Override
	public int hashCode() {
		int result = getId().hashCode();
		result = 31 * result + getPosition();
		result = 31 * result + length;
		return result;
	}

	@Override
	public String toString() {
		return "Delete{" + getId() + " @" + getPosition() + " x" + length + " base=" + getBaseRevision() + '}';
	}
}
