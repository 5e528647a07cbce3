package com.github.dimitryivaniuta.iam.projection.lock;

/**
 * A lock could not be acquired; some key is held by another locker.
 */
public class LockException extends RuntimeException {

    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
