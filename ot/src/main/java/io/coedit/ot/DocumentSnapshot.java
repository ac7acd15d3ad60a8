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

public final class DocumentSnapshot {
	public static final DocumentSnapshot EMPTY = new DocumentSnapshot(0, "");

	private final long revision;
	private final String content;

	private DocumentSnapshot(long revision, String content) {
		this.revision = revision;
		this.content = content;
	}

	public static DocumentSnapshot of(long revision, @NotNull String content) {
		checkArgument(revision >= 0, "Revision cannot be negative");
		return new DocumentSnapshot(revision, checkNotNull(content));
	}

	public long getRevision() {
		return revision;
	}

	public String getContent() {
		return content;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DocumentSnapshot that = (DocumentSnapshot) o;
		return revision == that.revision && content.equals(that.content);
	}

	@Override
	public int hashCode() {
		return 31 * Long.hashCode(revision) + content.hashCode();
	}

	@Override
	public String toString() {
		return "DocumentSnapshot{revision=" + revision + ", length=" + content.length() + '}';
	}
}
