package io.komorebi.document;

public final class QualifierGenerationException extends DocumentException {

    public QualifierGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
