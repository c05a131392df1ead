package me.internalizable.zikzi.conversion;

/**
 * A Ghostscript invocation failed, could not be started or timed out.
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
