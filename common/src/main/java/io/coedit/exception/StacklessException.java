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

package io.coedit.exception;

import org.jetbrains.annotations.Nullable;

/**
 * Checked exception without a stack trace.
 * <p>
 * Used for expected, per-request failures that are reported back to a caller.
 */
public class StacklessException extends Exception {
	@Nullable
	private final Class<?> component;

	public StacklessException() {
		this.component = null;
	}

	public StacklessException(String message) {
		super(message);
		this.component = null;
	}

	public StacklessException(String message, Throwable cause) {
		super(message, cause);
		this.component = null;
	}

	public StacklessException(Throwable cause) {
		super(cause);
		this.component = null;
	}

	public StacklessException(Class<?> component, String message) {
		super(message);
		this.component = component;
	}

	@Nullable
	public Class<?> getComponent() {
		return component;
	}

	@Override
	public final Throwable fillInStackTrace() {
		return this;
	}

	@Override
	public String toString() {
		String s = component != null ? component.getSimpleName() + " | " + getClass().getSimpleName() : getClass().getSimpleName();
		String message = getLocalizedMessage();
		return message != null ? s + ": " + message : s;
	}
}
