package me.internalizable.zikzi.api.store;

/**
 * Thrown by repository implementations when the backing store cannot complete an
 * operation.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
