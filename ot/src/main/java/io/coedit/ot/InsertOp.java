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

public final class InsertOp extends TextOp {
	private final String text;

	private InsertOp(OpId id, int position, String text, long baseRevision) {
		super(id, position, baseRevision);
		this.text = text;
	}

	public static InsertOp of(@NotNull OpId id, int position, @NotNull String text, long baseRevision) {
		return new InsertOp(id, position, checkNotNull(text, "Inserted text is required"), baseRevision);
	}

	public String getText() {
		return text;
	}

	@Override
	public int getLength() {
		return text.length();
	}

	@Override
	public OpKind getKind() {
		return OpKind.INSERT;
	}

	@Override
	public InsertOp withPosition(int position) {
		return new InsertOp(getId(), position, text, getBaseRevision());
	}

	@Override
	public InsertOp withBaseRevision(long baseRevision) {
		return new InsertOp(getId(), getPosition(), text, baseRevision);
	}

	/**
	 * The insert swallowed by a concurrent delete: nothing left to insert, anchored at {@code position}.
	 */
	InsertOp absorbedAt(int position) {
		return new InsertOp(getId(), position, "", getBaseRevision());
	}

	@Override
	boolean fits(int textLength) {
		return getPosition() <= textLength;
	}

	@Override
	void applyTo(StringBuilder buffer) {
		buffer.insert(getPosition(), text);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		InsertOp that = (InsertOp) o;
		return getPosition() == that.getPosition() &&
				getBaseRevision() == that.getBaseRevision() &&
				getId().equals(that.getId()) &&
				text.equals(that.text);
	}

	@Override
	public int hashCode() {
		int result = getId().hashCode();
		result = 31 * result + getPosition();
		result = 31 * result + text.hashCode();
		return result;
	}

	@Override
	public String toString() {
		return "Insert{" + getId() + " @" + getPosition() + " '" + text + "' base=" + getBaseRevision() + '}';
	}
}
