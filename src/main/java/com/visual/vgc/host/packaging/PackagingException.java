package com.visual.vgc.host.packaging;

/**
 * A failed packaging step. Packagers catch it and report a failed
 * {@link PackagingResult}; it never reaches the caller.
 */
public class PackagingException extends Exception {

    public PackagingException(String message) {
        super(message);
    }

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
