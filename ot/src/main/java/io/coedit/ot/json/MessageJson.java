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

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.coedit.ot.DeleteOp;
import io.coedit.ot.InsertOp;
import io.coedit.ot.OpId;
import io.coedit.ot.OpKind;
import io.coedit.ot.TextOp;
import io.coedit.ot.exceptions.MalformedOperationException;
import io.coedit.ot.exceptions.RejectReason;
import io.coedit.ot.messages.AckMessage;
import io.coedit.ot.messages.BroadcastMessage;
import io.coedit.ot.messages.RejectMessage;
import io.coedit.ot.messages.SubmitMessage;

import java.io.IOException;

import static io.coedit.ot.json.GsonAdapters.*;
import static io.coedit.util.Preconditions.checkArgument;

/**
 * Wire format of the collaboration messages.
 * <p>
 * Every message is a JSON object tagged with a {@code type} field. Operations are encoded as
 * <pre>{"id": "alice#3", "kind": "INSERT", "position": 5, "text": "!", "baseRevision": 7}</pre>
 * with {@code length} in place of {@code text} for deletions.
 */
public final class MessageJson {
	public static final String TYPE_SUBMIT = "submit";
	public static final String TYPE_BROADCAST = "broadcast";
	public static final String TYPE_ACK = "ack";
	public static final String TYPE_REJECT = "reject";

	private MessageJson() {
	}

	public static final TypeAdapter<OpId> OP_ID_JSON = transform(STRING_JSON, OpId::parse, OpId::toString);

	public static final TypeAdapter<OpKind> OP_KIND_JSON = ofEnum(OpKind.class);

	public static final TypeAdapter<RejectReason> REJECT_REASON_JSON = ofEnum(RejectReason.class);

	public static final TypeAdapter<TextOp> TEXT_OP_JSON = new TypeAdapter<TextOp>() {
		@Override
		public void write(JsonWriter out, TextOp op) throws IOException {
			out.beginObject();
			out.name("id");
			OP_ID_JSON.write(out, op.getId());
			out.name("kind");
			OP_KIND_JSON.write(out, op.getKind());
			out.name("position").value(op.getPosition());
			if (op instanceof InsertOp) {
				out.name("text").value(((InsertOp) op).getText());
			} else {
				out.name("length").value(op.getLength());
			}
			out.name("baseRevision").value(op.getBaseRevision());
			out.endObject();
		}

		@Override
		public TextOp read(JsonReader in) throws IOException {
			OpId id = null;
			OpKind kind = null;
			Integer position = null;
			String text = null;
			Integer length = null;
			Long baseRevision = null;
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				switch (name) {
					case "id":
						id = OP_ID_JSON.read(in);
						break;
					case "kind":
						kind = OP_KIND_JSON.read(in);
						break;
					case "position":
						position = INTEGER_JSON.read(in);
						break;
					case "text":
						text = STRING_JSON.read(in);
						break;
					case "length":
						length = INTEGER_JSON.read(in);
						break;
					case "baseRevision":
						baseRevision = LONG_JSON.read(in);
						break;
					default:
						in.skipValue();
				}
			}
			in.endObject();
			checkArgument(id != null && kind != null && position != null && baseRevision != null,
					"Operation requires id, kind, position and baseRevision");
			if (kind == OpKind.INSERT) {
				checkArgument(text != null, "Insert operation %s has no text", id);
				return InsertOp.of(id, position, text, baseRevision);
			}
			checkArgument(length != null, "Delete operation %s has no length", id);
			return DeleteOp.of(id, position, length, baseRevision);
		}
	};

	public static final TypeAdapter<SubmitMessage> SUBMIT_JSON = new TypeAdapter<SubmitMessage>() {
		@Override
		public void write(JsonWriter out, SubmitMessage message) throws IOException {
			out.beginObject();
			out.name("type").value(TYPE_SUBMIT);
			out.name("clientId").value(message.getClientId());
			out.name("operation");
			TEXT_OP_JSON.write(out, message.getOperation());
			out.name("baseRevision").value(message.getBaseRevision());
			out.endObject();
		}

		@Override
		public SubmitMessage read(JsonReader in) throws IOException {
			String clientId = null;
			TextOp operation = null;
			Long baseRevision = null;
			in.beginObject();
			while (in.hasNext()) {
				switch (in.nextName()) {
					case "type":
						checkType(in, TYPE_SUBMIT);
						break;
					case "clientId":
						clientId = STRING_JSON.read(in);
						break;
					case "operation":
						operation = TEXT_OP_JSON.read(in);
						break;
					case "baseRevision":
						baseRevision = LONG_JSON.read(in);
						break;
					default:
						in.skipValue();
				}
			}
			in.endObject();
			checkArgument(clientId != null && operation != null, "Submit message requires clientId and operation");
			return new SubmitMessage(clientId, operation, baseRevision != null ? baseRevision : operation.getBaseRevision());
		}
	};

	public static final TypeAdapter<BroadcastMessage> BROADCAST_JSON = new TypeAdapter<BroadcastMessage>() {
		@Override
		public void write(JsonWriter out, BroadcastMessage message) throws IOException {
			out.beginObject();
			out.name("type").value(TYPE_BROADCAST);
			out.name("revision").value(message.getRevision());
			out.name("operation");
			TEXT_OP_JSON.write(out, message.getOperation());
			out.name("authorId").value(message.getAuthorId());
			out.endObject();
		}

		@Override
		public BroadcastMessage read(JsonReader in) throws IOException {
			Long revision = null;
			TextOp operation = null;
			String authorId = null;
			in.beginObject();
			while (in.hasNext()) {
				switch (in.nextName()) {
					case "type":
						checkType(in, TYPE_BROADCAST);
						break;
					case "revision":
						revision = LONG_JSON.read(in);
						break;
					case "operation":
						operation = TEXT_OP_JSON.read(in);
						break;
					case "authorId":
						authorId = STRING_JSON.read(in);
						break;
					default:
						in.skipValue();
				}
			}
			in.endObject();
			checkArgument(revision != null && operation != null, "Broadcast message requires revision and operation");
			return new BroadcastMessage(revision, operation, authorId != null ? authorId : operation.getAuthorId());
		}
	};

	public static final TypeAdapter<AckMessage> ACK_JSON = new TypeAdapter<AckMessage>() {
		@Override
		public void write(JsonWriter out, AckMessage message) throws IOException {
			out.beginObject();
			out.name("type").value(TYPE_ACK);
			out.name("ackedOpId");
			OP_ID_JSON.write(out, message.getAckedOpId());
			out.name("revision").value(message.getRevision());
			out.endObject();
		}

		@Override
		public AckMessage read(JsonReader in) throws IOException {
			OpId opId = null;
			Long revision = null;
			in.beginObject();
			while (in.hasNext()) {
				switch (in.nextName()) {
					case "type":
						checkType(in, TYPE_ACK);
						break;
					case "ackedOpId":
						opId = OP_ID_JSON.read(in);
						break;
					case "revision":
						revision = LONG_JSON.read(in);
						break;
					default:
						in.skipValue();
				}
			}
			in.endObject();
			checkArgument(opId != null && revision != null, "Ack message requires ackedOpId and revision");
			return new AckMessage(opId, revision);
		}
	};

	private static final TypeAdapter<OpId> NULLABLE_OP_ID_JSON = asNullable(OP_ID_JSON);

	public static final TypeAdapter<RejectMessage> REJECT_JSON = new TypeAdapter<RejectMessage>() {
		@Override
		public void write(JsonWriter out, RejectMessage message) throws IOException {
			out.beginObject();
			out.name("type").value(TYPE_REJECT);
			out.name("opId");
			NULLABLE_OP_ID_JSON.write(out, message.getOpId());
			out.name("reason");
			REJECT_REASON_JSON.write(out, message.getReason());
			out.name("message").value(message.getMessage());
			out.endObject();
		}

		@Override
		public RejectMessage read(JsonReader in) throws IOException {
			OpId opId = null;
			RejectReason reason = null;
			String text = "";
			in.beginObject();
			while (in.hasNext()) {
				switch (in.nextName()) {
					case "type":
						checkType(in, TYPE_REJECT);
						break;
					case "opId":
						opId = NULLABLE_OP_ID_JSON.read(in);
						break;
					case "reason":
						reason = REJECT_REASON_JSON.read(in);
						break;
					case "message":
						text = STRING_JSON.read(in);
						break;
					default:
						in.skipValue();
				}
			}
			in.endObject();
			checkArgument(reason != null, "Reject message requires reason");
			return new RejectMessage(opId, reason, text);
		}
	};

	private static void checkType(JsonReader in, String expected) throws IOException {
		String type = in.nextString();
		checkArgument(expected.equals(type), "Expected message of type '%s', got '%s'", expected, type);
	}

	/**
	 * Decodes an inbound submission.
	 *
	 * @throws MalformedOperationException if the text is not a well-formed submit message
	 */
	public static SubmitMessage decodeSubmit(String json) throws MalformedOperationException {
		try {
			return fromJson(SUBMIT_JSON, json);
		} catch (JsonException e) {
			throw new MalformedOperationException(null, "Malformed submit message: " + causeMessage(e), e);
		}
	}

	public static BroadcastMessage decodeBroadcast(String json) throws JsonException {
		return fromJson(BROADCAST_JSON, json);
	}

	public static AckMessage decodeAck(String json) throws JsonException {
		return fromJson(ACK_JSON, json);
	}

	public static RejectMessage decodeReject(String json) throws JsonException {
		return fromJson(REJECT_JSON, json);
	}

	public static String encode(SubmitMessage message) {
		return toJson(SUBMIT_JSON, message);
	}

	public static String encode(BroadcastMessage message) {
		return toJson(BROADCAST_JSON, message);
	}

	public static String encode(AckMessage message) {
		return toJson(ACK_JSON, message);
	}

	public static String encode(RejectMessage message) {
		return toJson(REJECT_JSON, message);
	}

	private static String causeMessage(JsonException e) {
		Throwable cause = e.getCause() != null ? e.getCause() : e;
		return String.valueOf(cause.getMessage());
	}
}
