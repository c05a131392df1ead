package me.internalizable.zikzi.ipp;

/**
 * Status codes sent in responses.
 */
public final class IppStatus {

    public static final int SUCCESSFUL_OK = 0x0000;
    public static final int CLIENT_ERROR_BAD_REQUEST = 0x0400;
    public static final int CLIENT_ERROR_NOT_AUTHORIZED = 0x0403;
    public static final int CLIENT_ERROR_NOT_FOUND = 0x0406;
    public static final int SERVER_ERROR_INTERNAL_ERROR = 0x0500;
    public static final int SERVER_ERROR_OPERATION_NOT_SUPPORTED = 0x0501;

    private IppStatus() {
    }
}
