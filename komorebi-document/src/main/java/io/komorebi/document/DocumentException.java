package io.komorebi.document;

public sealed class DocumentException extends RuntimeException
    permits MalformedManifestException,
            QualifierGenerationException {

    protected DocumentException(String message) {
        super(message);
    }

    protected DocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
