package io.github.jbellis.xmldoc;

/**
 * Thrown when documentation comment text is not a well-formed XML fragment.
 */
public class MalformedDocCommentException extends IllegalArgumentException {
    private final String rawText;

    public MalformedDocCommentException(String rawText, Throwable cause) {
        super("Malformed documentation comment: " + cause.getMessage(), cause);
        this.rawText = rawText;
    }

    /**
     * The comment text as supplied by the caller, before wrapping.
     */
    public String getRawText() {
        return rawText;
    }
}
