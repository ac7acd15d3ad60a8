package io.coedit.ot.json;

public class JsonException extends Exception {
	public JsonException(String message) {
		super(message);
	}

	public JsonException(Throwable cause) {
		super(cause);
	}
}
