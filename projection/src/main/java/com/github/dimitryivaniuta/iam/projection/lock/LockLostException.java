package com.github.dimitryivaniuta.iam.projection.lock;

/**
 * A held lock was lost (renewal failed, expired or taken over). Work under it must stop.
 */
public class LockLostException extends RuntimeException {

    public LockLostException(String message) {
        super(message);
    }

    public LockLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
