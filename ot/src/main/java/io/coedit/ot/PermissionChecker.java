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

/**
 * Answers capability queries for connected clients. Supplied by whatever handles
 * authentication and sharing; the engine only consumes the yes/no answer.
 */
@FunctionalInterface
public interface PermissionChecker {
	boolean hasCapability(String clientId, Capability capability);

	static PermissionChecker allowAll() {
		return (clientId, capability) -> true;
	}
}
