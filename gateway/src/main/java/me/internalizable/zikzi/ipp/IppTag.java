package me.internalizable.zikzi.ipp;

/**
 * Tag bytes of the IPP binary encoding.
 *
 * <p>Values below {@code 0x10} delimit attribute groups, {@code 0x10..0x1F} are out-of-band
 * values without content, everything above is a value syntax.</p>
 */
public final class IppTag {

    // ==================== Delimiters ====================

    public static final int OPERATION = 0x01;
    public static final int JOB = 0x02;
    public static final int END = 0x03;
    public static final int PRINTER = 0x04;

    // ==================== Out-of-band ====================

    public static final int NO_VALUE = 0x13;

    // ==================== Values ====================

    public static final int INTEGER = 0x21;
    public static final int BOOLEAN = 0x22;
    public static final int ENUM = 0x23;
    public static final int RESOLUTION = 0x32;
    public static final int RANGE = 0x33;
    public static final int BEGIN_COLLECTION = 0x34;
    public static final int TEXT_WITH_LANGUAGE = 0x35;
    public static final int NAME_WITH_LANGUAGE = 0x36;
    public static final int END_COLLECTION = 0x37;
    public static final int TEXT = 0x41;
    public static final int NAME = 0x42;
    public static final int KEYWORD = 0x44;
    public static final int URI = 0x45;
    public static final int CHARSET = 0x47;
    public static final int NATURAL_LANGUAGE = 0x48;
    public static final int MIME_MEDIA_TYPE = 0x49;
    public static final int MEMBER_ATTR_NAME = 0x4A;

    private IppTag() {
    }

    public static boolean isDelimiter(int tag) {
        return tag >= 0x00 && tag < 0x10;
    }

    public static boolean isOutOfBand(int tag) {
        return tag >= 0x10 && tag <= 0x1F;
    }

    /**
     * Whether values of this tag are character strings (text, name, keyword, uri, ...).
     */
    public static boolean isCharacterString(int tag) {
        return tag >= 0x40 && tag <= 0x5F && tag != MEMBER_ATTR_NAME;
    }
}
