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

import io.coedit.ot.exceptions.MalformedOperationException;
import org.jetbrains.annotations.NotNull;

import static io.coedit.util.Preconditions.checkArgument;

/**
 * Mutable text buffer that text operations are applied to.
 * Not thread-safe, callers guard it.
 */
public final class TextState implements OTState<TextOp> {
	private final StringBuilder text = new StringBuilder();

	public TextState() {
	}

	public TextState(@NotNull String initial) {
		text.append(initial);
	}

	@Override
	public void init() {
		text.setLength(0);
	}

	public void reset(@NotNull String content) {
		text.setLength(0);
		text.append(content);
	}

	/**
	 * Applies the operation, which must fit the current text.
	 *
	 * @throws IllegalArgumentException if the operation is out of bounds
	 */
	@Override
	public void apply(TextOp op) {
		checkArgument(op.fits(text.length()), () -> "Operation " + op + " does not fit text of length " + text.length());
		op.applyTo(text);
	}

	public void validate(TextOp op) throws MalformedOperationException {
		if (!op.fits(text.length())) {
			throw new MalformedOperationException(op.getId(),
					"Operation " + op + " is out of bounds of text of length " + text.length());
		}
	}

	public int length() {
		return text.length();
	}

	public String getText() {
		return text.toString();
	}

	@Override
	public String toString() {
		return "TextState{length=" + text.length() + '}';
	}
}
