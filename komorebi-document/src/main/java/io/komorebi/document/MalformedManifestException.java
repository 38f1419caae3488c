package io.komorebi.document;

public final class MalformedManifestException extends DocumentException {

    public MalformedManifestException(String message) {
        super(message);
    }

    public MalformedManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
