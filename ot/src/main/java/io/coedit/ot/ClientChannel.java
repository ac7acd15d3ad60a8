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

import io.coedit.ot.messages.AckMessage;
import io.coedit.ot.messages.BroadcastMessage;
import io.coedit.ot.messages.RejectMessage;

/**
 * Outbound side of the transport for one connected client.
 * <p>
 * Calls for a session arrive one at a time, in revision order; rejections may
 * arrive from the thread that forwarded the rejected operation.
 */
public interface ClientChannel {
	void onBroadcast(BroadcastMessage message);

	void onAck(AckMessage message);

	void onReject(RejectMessage message);
}
