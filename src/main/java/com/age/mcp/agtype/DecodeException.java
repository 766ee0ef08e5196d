package com.age.mcp.agtype;

/**
 * Runtime exception thrown when agtype or JSON text cannot be decoded.
 * Carries the text that failed so callers can report the upstream query problem.
 */
public class DecodeException extends RuntimeException {

    private static final int MAX_MESSAGE_TEXT = 200;

    private final String text;

    public DecodeException(String message, String text) {
        super(message + ": " + abbreviate(text));
        this.text = text;
    }

    public DecodeException(String message, String text, Throwable cause) {
        super(message + ": " + abbreviate(text), cause);
        this.text = text;
    }

    /**
     * Returns the full text that failed to decode.
     */
    public String getText() {
        return text;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        if (text.length() <= MAX_MESSAGE_TEXT) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_TEXT) + "... (" + text.length() + " chars)";
    }
}
