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

import static io.coedit.util.Preconditions.checkArgument;
import static java.lang.Math.max;
import static java.lang.Math.min;

/**
 * Caret position plus the anchor of a selection; the selection is empty when both coincide.
 */
public final class Cursor {
	public static final Cursor ZERO = new Cursor(0, 0);

	private final int position;
	private final int anchor;

	private Cursor(int position, int anchor) {
		this.position = position;
		this.anchor = anchor;
	}

	public static Cursor at(int position) {
		return of(position, position);
	}

	public static Cursor of(int position, int anchor) {
		checkArgument(position >= 0 && anchor >= 0, "Cursor offsets cannot be negative");
		return new Cursor(position, anchor);
	}

	public int getPosition() {
		return position;
	}

	public int getAnchor() {
		return anchor;
	}

	public int getSelectionStart() {
		return min(position, anchor);
	}

	public int getSelectionEnd() {
		return max(position, anchor);
	}

	public boolean hasSelection() {
		return position != anchor;
	}

	/**
	 * Re-projects the cursor through an applied operation.
	 *
	 * @param own whether the operation was made by the cursor owner; an own insert
	 *            at the caret pushes the caret past the inserted text
	 */
	public Cursor transform(TextOp op, boolean own) {
		int newPosition = project(position, op, own);
		int newAnchor = project(anchor, op, own);
		return newPosition == position && newAnchor == anchor ? this : new Cursor(newPosition, newAnchor);
	}

	public Cursor clamp(int length) {
		return position <= length && anchor <= length ? this : new Cursor(min(position, length), min(anchor, length));
	}

	static int project(int offset, TextOp op, boolean own) {
		int at = op.getPosition();
		if (op instanceof InsertOp) {
			return at < offset || (at == offset && own) ? offset + op.getLength() : offset;
		}
		int end = at + op.getLength();
		if (offset <= at) {
			return offset;
		}
		return offset >= end ? offset - op.getLength() : at;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Cursor cursor = (Cursor) o;
		return position == cursor.position && anchor == cursor.anchor;
	}

	@Override
	public int hashCode() {
		return 31 * position + anchor;
	}

	@Override
	public String toString() {
		return hasSelection() ? "[" + anchor + ".." + position + "]" : "[" + position + "]";
	}
}
