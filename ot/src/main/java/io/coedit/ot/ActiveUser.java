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

public final class ActiveUser {
	private final String clientId;
	private final Cursor cursor;

	public ActiveUser(@NotNull String clientId, @NotNull Cursor cursor) {
		this.clientId = checkNotNull(clientId);
		this.cursor = checkNotNull(cursor);
	}

	public String getClientId() {
		return clientId;
	}

	public Cursor getCursor() {
		return cursor;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ActiveUser that = (ActiveUser) o;
		return clientId.equals(that.clientId) && cursor.equals(that.cursor);
	}

	@Override
	public int hashCode() {
		return 31 * clientId.hashCode() + cursor.hashCode();
	}

	@Override
	public String toString() {
		return clientId + cursor;
	}
}
