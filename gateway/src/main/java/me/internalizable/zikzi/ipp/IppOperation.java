package me.internalizable.zikzi.ipp;

/**
 * Operation ids understood by the gateway.
 */
public final class IppOperation {

    public static final int PRINT_JOB = 0x0002;
    public static final int VALIDATE_JOB = 0x0004;
    public static final int CANCEL_JOB = 0x0008;
    public static final int GET_JOB_ATTRIBUTES = 0x0009;
    public static final int GET_JOBS = 0x000A;
    public static final int GET_PRINTER_ATTRIBUTES = 0x000B;

    private IppOperation() {
    }

    /**
     * Operations that can be answered without knowing the user. Every other operation,
     * including unknown ones, goes through authentication first.
     */
    public static boolean isAnonymous(int operation) {
        return operation == GET_PRINTER_ATTRIBUTES || operation == GET_JOB_ATTRIBUTES;
    }

    public static String name(int operation) {
        switch (operation) {
            case PRINT_JOB:
                return "Print-Job";
            case VALIDATE_JOB:
                return "Validate-Job";
            case CANCEL_JOB:
                return "Cancel-Job";
            case GET_JOB_ATTRIBUTES:
                return "Get-Job-Attributes";
            case GET_JOBS:
                return "Get-Jobs";
            case GET_PRINTER_ATTRIBUTES:
                return "Get-Printer-Attributes";
            default:
                return String.format("0x%04X", operation);
        }
    }
}
