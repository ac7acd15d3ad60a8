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

import java.util.List;

/**
 * Rewrites operations so that concurrent edits commute.
 *
 * @param <D> type of operations
 */
public interface OTSystem<D> {

	/**
	 * Returns {@code left} rewritten to be applied after {@code right}, both operations
	 * having been composed against the same state.
	 */
	D transform(D left, D right);

	/**
	 * Rewrites {@code op} through every operation of {@code applied} in order.
	 */
	default D transform(D op, List<? extends D> applied) {
		D result = op;
		for (D right : applied) {
			result = transform(result, right);
		}
		return result;
	}

	boolean isEmpty(D op);
}
