package com.agentos.core.llm;

/**
 * Thrown when LLM output is not valid JSON or does not match the expected type.
 * Keeps the first 200 characters of the offending text for diagnostics.
 */
public class LlmParseException extends RuntimeException {

    static final int EXCERPT_LENGTH = 200;

    private final String responseExcerpt;

    public LlmParseException(String message, String responseText) {
        super(message);
        this.responseExcerpt = excerpt(responseText);
    }

    public LlmParseException(String message, String responseText, Throwable cause) {
        super(message, cause);
        this.responseExcerpt = excerpt(responseText);
    }

    public String getResponseExcerpt() {
        return responseExcerpt;
    }

    private static String excerpt(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH);
    }
}
