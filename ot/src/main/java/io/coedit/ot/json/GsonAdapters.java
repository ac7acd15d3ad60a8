package io.coedit.ot.json;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.function.Function;

public class GsonAdapters {

	public static final TypeAdapter<Integer> INTEGER_JSON = new TypeAdapter<Integer>() {
		@Override
		public void write(JsonWriter out, Integer value) throws IOException {
			out.value(value);
		}

		@Override
		public Integer read(JsonReader in) throws IOException {
			return in.nextInt();
		}
	};

	public static final TypeAdapter<Long> LONG_JSON = new TypeAdapter<Long>() {
		@Override
		public void write(JsonWriter out, Long value) throws IOException {
			out.value(value);
		}

		@Override
		public Long read(JsonReader in) throws IOException {
			return in.nextLong();
		}
	};

	public static final TypeAdapter<String> STRING_JSON = new TypeAdapter<String>() {
		@Override
		public void write(JsonWriter out, String value) throws IOException {
			out.value(value);
		}

		@Override
		public String read(JsonReader in) throws IOException {
			return in.nextString();
		}
	};

	public static <E extends Enum<E>> TypeAdapter<E> ofEnum(final Class<E> enumType) {
		return new TypeAdapter<E>() {
			@Override
			public void write(JsonWriter out, E value) throws IOException {
				out.value(value.name());
			}

			@Override
			public E read(JsonReader in) throws IOException {
				return Enum.valueOf(enumType, in.nextString());
			}
		};
	}

	public static <I, O> TypeAdapter<O> transform(final TypeAdapter<I> adapter, final Function<I, O> from, final Function<O, I> to) {
		return new TypeAdapter<O>() {
			@Override
			public void write(JsonWriter out, O value) throws IOException {
				adapter.write(out, to.apply(value));
			}

			@Override
			public O read(JsonReader in) throws IOException {
				return from.apply(adapter.read(in));
			}
		};
	}

	public static <T> TypeAdapter<T> asNullable(final TypeAdapter<T> adapter) {
		return new TypeAdapter<T>() {
			@Override
			public void write(JsonWriter out, T value) throws IOException {
				if (value == null) {
					out.nullValue();
				} else {
					adapter.write(out, value);
				}
			}

			@Override
			public T read(JsonReader in) throws IOException {
				if (in.peek() == JsonToken.NULL) {
					in.nextNull();
					return null;
				}
				return adapter.read(in);
			}
		};
	}

	public static <T> T fromJson(TypeAdapter<T> typeAdapter, String string) throws JsonException {
		JsonReader jsonReader = new JsonReader(new StringReader(string));
		try {
			T result = typeAdapter.read(jsonReader);
			if (jsonReader.peek() != JsonToken.END_DOCUMENT) {
				throw new JsonException("Unexpected trailing content");
			}
			return result;
		} catch (JsonException e) {
			throw e;
		} catch (Exception e) {
			throw new JsonException(e);
		}
	}

	public static <T> String toJson(TypeAdapter<T> typeAdapter, T value) {
		StringWriter writer = new StringWriter();
		JsonWriter jsonWriter = new JsonWriter(writer);
		jsonWriter.setHtmlSafe(false);
		jsonWriter.setSerializeNulls(true);
		try {
			typeAdapter.write(jsonWriter, value);
		} catch (IOException e) {
			throw new AssertionError(e);
		}
		return writer.toString();
	}

}
