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
 * Immutable plain-text edit: an insert or a delete at a character offset.
 * <p>
 * Transformations never modify an operation; they derive a new value carrying
 * the same {@link OpId}, so an operation can be tracked across rewrites.
 */
public abstract class TextOp {
	private final OpId id;
	private final int position;
	private final long baseRevision;

	TextOp(@NotNull OpId id, int position, long baseRevision) {
		this.id = checkNotNull(id);
		checkArgument(position >= 0, "Position cannot be negative: %s", position);
		checkArgument(baseRevision >= 0, "Base revision cannot be negative: %s", baseRevision);
		this.position = position;
		this.baseRevision = baseRevision;
	}

	public final OpId getId() {
		return id;
	}

	public final String getAuthorId() {
		return id.getAuthorId();
	}

	public final int getPosition() {
		return position;
	}

	public final long getBaseRevision() {
		return baseRevision;
	}

	/**
	 * Number of characters inserted or deleted.
	 */
	public abstract int getLength();

	public abstract OpKind getKind();

	public final boolean isEmpty() {
		return getLength() == 0;
	}

	public abstract TextOp withPosition(int position);

	public abstract TextOp withBaseRevision(long baseRevision);

	/**
	 * Whether this operation addresses characters that exist in a text of the given length.
	 */
	abstract boolean fits(int textLength);

	abstract void applyTo(StringBuilder text);
}
