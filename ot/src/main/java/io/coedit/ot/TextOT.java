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

import static java.lang.Math.max;
import static java.lang.Math.min;

/**
 * Transformation rules for plain-text inserts and deletes.
 * <p>
 * Every rule answers one question: where does the left operation land once the right
 * one has already been applied? Together they satisfy
 * {@code apply(apply(s, b), transform(a, b)) == apply(apply(s, a), transform(b, a))}.
 * <ul>
 * <li>Inserts at the same offset are ordered by {@link OpId}: the lower author goes first.</li>
 * <li>A delete swallows any insert that lands strictly inside its range,
 * whichever order the two are applied in.</li>
 * <li>Overlapping deletes only remove what the other has not already removed.</li>
 * </ul>
 */
public final class TextOT {
	private TextOT() {
	}

	public static OTSystem<TextOp> create() {
		return OTSystemImpl.<TextOp>create()
				.withTransformFunction(InsertOp.class, InsertOp.class, TextOT::transformInsertInsert)
				.withTransformFunction(InsertOp.class, DeleteOp.class, TextOT::transformInsertDelete)
				.withTransformFunction(DeleteOp.class, InsertOp.class, TextOT::transformDeleteInsert)
				.withTransformFunction(DeleteOp.class, DeleteOp.class, TextOT::transformDeleteDelete)
				.withEmptyPredicate(InsertOp.class, TextOp::isEmpty)
				.withEmptyPredicate(DeleteOp.class, TextOp::isEmpty);
	}

	static TextOp transformInsertInsert(InsertOp left, InsertOp right) {
		int position = left.getPosition();
		if (position < right.getPosition()) {
			return left;
		}
		if (position == right.getPosition() && precedes(left, right)) {
			return left;
		}
		return left.withPosition(position + right.getLength());
	}

	static TextOp transformInsertDelete(InsertOp left, DeleteOp right) {
		int position = left.getPosition();
		if (position <= right.getPosition()) {
			return left;
		}
		if (position >= right.getEnd()) {
			return left.withPosition(position - right.getLength());
		}
		return left.absorbedAt(right.getPosition());
	}

	static TextOp transformDeleteInsert(DeleteOp left, InsertOp right) {
		int insertAt = right.getPosition();
		if (insertAt <= left.getPosition()) {
			return left.withPosition(left.getPosition() + right.getLength());
		}
		if (insertAt < left.getEnd()) {
			return left.withLength(left.getLength() + right.getLength());
		}
		return left;
	}

	static TextOp transformDeleteDelete(DeleteOp left, DeleteOp right) {
		int overlap = max(0, min(left.getEnd(), right.getEnd()) - max(left.getPosition(), right.getPosition()));
		int start;
		if (left.getPosition() <= right.getPosition()) {
			start = left.getPosition();
		} else if (left.getPosition() >= right.getEnd()) {
			start = left.getPosition() - right.getLength();
		} else {
			start = right.getPosition();
		}
		if (start == left.getPosition() && overlap == 0) {
			return left;
		}
		return left.withRange(start, left.getLength() - overlap);
	}

	static boolean precedes(TextOp left, TextOp right) {
		return left.getId().compareTo(right.getId()) < 0;
	}
}
