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

package io.coedit.ot.json;

import io.coedit.ot.ClientChannel;
import io.coedit.ot.messages.AckMessage;
import io.coedit.ot.messages.BroadcastMessage;
import io.coedit.ot.messages.RejectMessage;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

import static io.coedit.util.Preconditions.checkNotNull;

/**
 * Adapts a text transport, such as a websocket, to a {@link ClientChannel}
 * by encoding every outbound message with {@link MessageJson}.
 */
public final class JsonClientChannel implements ClientChannel {
	private final Consumer<String> sink;

	private JsonClientChannel(Consumer<String> sink) {
		this.sink = sink;
	}

	public static JsonClientChannel create(@NotNull Consumer<String> sink) {
		return new JsonClientChannel(checkNotNull(sink));
	}

	@Override
	public void onBroadcast(BroadcastMessage message) {
		sink.accept(MessageJson.encode(message));
	}

	@Override
	public void onAck(AckMessage message) {
		sink.accept(MessageJson.encode(message));
	}

	@Override
	public void onReject(RejectMessage message) {
		sink.accept(MessageJson.encode(message));
	}
}
