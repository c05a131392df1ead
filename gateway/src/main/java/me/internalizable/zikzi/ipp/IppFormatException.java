package me.internalizable.zikzi.ipp;

/**
 * Thrown when a request body is not a well-formed IPP message.
 */
public class IppFormatException extends Exception {

    public IppFormatException(String message) {
        super(message);
    }
}
