package com.gomesguardian.common.exception;

/**
 * An external collaborator (AI classifier) could not answer: missing key,
 * timeout, transport error or unparseable response. Always recovered by a
 * deterministic fallback.
 */
public class CollaboratorUnavailableException extends GomesException {

    public CollaboratorUnavailableException(String component, String message) {
        super(component, message);
    }

    public CollaboratorUnavailableException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
