package me.internalizable.zikzi.ipp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary encoding of IPP messages (RFC 8010).
 *
 * <pre>
 * version-number(2) operation-id|status-code(2) request-id(4)
 * { begin-attribute-group-tag(1) { value-tag(1) name-length(2) name value-length(2) value }* }*
 * end-of-attributes-tag(1)
 * [document data]
 * </pre>
 *
 * <p>An attribute with an empty name adds a value to the preceding attribute. Collections
 * are framed by {@code begCollection} and {@code endCollection}, each member introduced by
 * a {@code memberAttrName} value.</p>
 */
public final class IppCodec {

    /** Version, operation and request id. */
    public static final int HEADER_LENGTH = 8;

    private IppCodec() {
    }

    // ==================== Decoding ====================

    /**
     * Decodes the message at the reader index. On success the reader index is left just after
     * the end-of-attributes tag.
     *
     * @throws IppFormatException if the message is truncated or malformed
     */
    @Nonnull
    public static IppMessage decode(@Nonnull ByteBuf in) throws IppFormatException {
        if (in.readableBytes() < HEADER_LENGTH) {
            throw new IppFormatException("Message shorter than the " + HEADER_LENGTH + " byte header");
        }
        IppMessage message = new IppMessage(in.readUnsignedByte(), in.readUnsignedByte(),
            in.readUnsignedShort(), in.readInt());

        IppAttributeGroup group = null;
        IppAttribute attribute = null;
        while (true) {
            if (!in.isReadable()) {
                throw new IppFormatException("Missing end-of-attributes tag");
            }
            int tag = in.readUnsignedByte();
            if (tag == IppTag.END) {
                return message;
            }
            if (IppTag.isDelimiter(tag)) {
                group = message.addGroup(tag);
                attribute = null;
                continue;
            }
            if (group == null) {
                throw new IppFormatException(String.format("Attribute tag 0x%02X outside of a group", tag));
            }

            String name = readString(in, "attribute name");
            IppValue value = readValue(in, tag);
            if (name.isEmpty()) {
                if (attribute == null) {
                    throw new IppFormatException("Additional value without a preceding attribute");
                }
                attribute.addValue(value);
            } else {
                attribute = new IppAttribute(name, value);
                group.add(attribute);
            }
        }
    }

    private static IppValue readValue(ByteBuf in, int tag) throws IppFormatException {
        if (tag == IppTag.BEGIN_COLLECTION) {
            in.skipBytes(readLength(in, "collection value"));
            return IppValue.collection(readCollection(in));
        }

        int length = readLength(in, "value");
        if (IppTag.isOutOfBand(tag)) {
            in.skipBytes(length);
            return IppValue.outOfBand(tag);
        }

        switch (tag) {
            case IppTag.INTEGER:
            case IppTag.ENUM:
                expectLength(tag, length, 4);
                return tag == IppTag.INTEGER ? IppValue.integer(in.readInt()) : IppValue.enumValue(in.readInt());
            case IppTag.BOOLEAN:
                expectLength(tag, length, 1);
                return IppValue.bool(in.readByte() != 0);
            case IppTag.RESOLUTION:
                expectLength(tag, length, 9);
                return IppValue.resolution(in.readInt(), in.readInt(), in.readUnsignedByte());
            case IppTag.RANGE:
                expectLength(tag, length, 8);
                return IppValue.range(in.readInt(), in.readInt());
            case IppTag.TEXT_WITH_LANGUAGE:
            case IppTag.NAME_WITH_LANGUAGE:
                return readWithLanguage(in, tag, length);
            default:
                if (IppTag.isCharacterString(tag)) {
                    return IppValue.string(tag, in.readCharSequence(length, StandardCharsets.UTF_8).toString());
                }
                byte[] bytes = new byte[length];
                in.readBytes(bytes);
                return IppValue.octets(tag, bytes);
        }
    }

    private static List<IppAttribute> readCollection(ByteBuf in) throws IppFormatException {
        List<IppAttribute> members = new ArrayList<>();
        IppAttribute member = null;
        while (true) {
            if (!in.isReadable()) {
                throw new IppFormatException("Unterminated collection");
            }
            int tag = in.readUnsignedByte();
            in.skipBytes(readLength(in, "member name"));

            if (tag == IppTag.END_COLLECTION) {
                in.skipBytes(readLength(in, "end of collection"));
                return members;
            }
            if (tag == IppTag.MEMBER_ATTR_NAME) {
                int length = readLength(in, "member name value");
                member = new IppAttribute(in.readCharSequence(length, StandardCharsets.UTF_8).toString());
                members.add(member);
                continue;
            }
            if (IppTag.isDelimiter(tag)) {
                throw new IppFormatException(String.format("Delimiter 0x%02X inside a collection", tag));
            }
            if (member == null) {
                throw new IppFormatException("Collection value without a member name");
            }
            member.addValue(readValue(in, tag));
        }
    }

    private static IppValue readWithLanguage(ByteBuf in, int tag, int length) throws IppFormatException {
        int end = in.readerIndex() + length;
        String language = readString(in, "language");
        String text = readString(in, "text");
        if (in.readerIndex() != end) {
            throw new IppFormatException(String.format("Value with tag 0x%02X has inconsistent lengths", tag));
        }
        return IppValue.withLanguage(tag, language, text);
    }

    private static String readString(ByteBuf in, String what) throws IppFormatException {
        int length = readLength(in, what);
        return in.readCharSequence(length, StandardCharsets.UTF_8).toString();
    }

    /**
     * Reads a two-byte length and checks that as many bytes follow.
     */
    private static int readLength(ByteBuf in, String what) throws IppFormatException {
        if (in.readableBytes() < 2) {
            throw new IppFormatException("Truncated " + what + " length");
        }
        int length = in.readUnsignedShort();
        if (in.readableBytes() < length) {
            throw new IppFormatException("Truncated " + what + ": " + length + " bytes announced, "
                + in.readableBytes() + " available");
        }
        return length;
    }

    private static void expectLength(int tag, int actual, int expected) throws IppFormatException {
        if (actual != expected) {
            throw new IppFormatException(String.format("Value with tag 0x%02X must be %d bytes, got %d",
                tag, expected, actual));
        }
    }

    // ==================== Document ====================

    /**
     * Returns the document data following the attributes of a request body, as a slice of
     * {@code body} that shares its reference count.
     *
     * <p>The data starts after the first {@code 0x03} byte found from offset 8 on. The
     * result is empty when there is no such byte or it is the last one.</p>
     */
    @Nonnull
    public static ByteBuf extractDocument(@Nonnull ByteBuf body) {
        int start = body.readerIndex() + HEADER_LENGTH;
        int end = body.writerIndex();
        if (start >= end) {
            return Unpooled.EMPTY_BUFFER;
        }
        int tagIndex = body.indexOf(start, end, (byte) IppTag.END);
        if (tagIndex < 0 || tagIndex == end - 1) {
            return Unpooled.EMPTY_BUFFER;
        }
        return body.slice(tagIndex + 1, end - tagIndex - 1);
    }

    // ==================== Encoding ====================

    public static void encode(@Nonnull IppMessage message, @Nonnull ByteBuf out) {
        out.writeByte(message.getMajorVersion());
        out.writeByte(message.getMinorVersion());
        out.writeShort(message.getCode());
        out.writeInt(message.getRequestId());
        for (IppAttributeGroup group : message.getGroups()) {
            out.writeByte(group.getTag());
            for (IppAttribute attribute : group.getAttributes()) {
                writeAttribute(attribute, out);
            }
        }
        out.writeByte(IppTag.END);
    }

    private static void writeAttribute(IppAttribute attribute, ByteBuf out) {
        List<IppValue> values = attribute.getValues();
        if (values.isEmpty()) {
            writeValue(attribute.getName(), IppValue.outOfBand(IppTag.NO_VALUE), out);
            return;
        }
        for (int i = 0; i < values.size(); i++) {
            writeValue(i == 0 ? attribute.getName() : "", values.get(i), out);
        }
    }

    private static void writeValue(String name, IppValue value, ByteBuf out) {
        int tag = value.getTag();
        out.writeByte(tag);
        writeString(name, out);

        if (value.isOutOfBand()) {
            out.writeShort(0);
            return;
        }

        switch (tag) {
            case IppTag.INTEGER:
            case IppTag.ENUM:
                out.writeShort(4);
                out.writeInt(value.asInt());
                break;
            case IppTag.BOOLEAN:
                out.writeShort(1);
                out.writeByte((Boolean) value.getValue() ? 1 : 0);
                break;
            case IppTag.RESOLUTION: {
                IppValue.Resolution resolution = (IppValue.Resolution) value.getValue();
                out.writeShort(9);
                out.writeInt(resolution.getCrossFeed());
                out.writeInt(resolution.getFeed());
                out.writeByte(resolution.getUnits());
                break;
            }
            case IppTag.RANGE: {
                IppValue.Range range = (IppValue.Range) value.getValue();
                out.writeShort(8);
                out.writeInt(range.getLower());
                out.writeInt(range.getUpper());
                break;
            }
            case IppTag.TEXT_WITH_LANGUAGE:
            case IppTag.NAME_WITH_LANGUAGE: {
                IppValue.StringWithLanguage text = (IppValue.StringWithLanguage) value.getValue();
                byte[] language = text.getLanguage().getBytes(StandardCharsets.UTF_8);
                byte[] content = text.getText().getBytes(StandardCharsets.UTF_8);
                out.writeShort(4 + language.length + content.length);
                out.writeShort(language.length);
                out.writeBytes(language);
                out.writeShort(content.length);
                out.writeBytes(content);
                break;
            }
            case IppTag.BEGIN_COLLECTION:
                out.writeShort(0);
                for (IppAttribute member : value.asCollection()) {
                    writeMember(member, out);
                }
                out.writeByte(IppTag.END_COLLECTION);
                out.writeShort(0);
                out.writeShort(0);
                break;
            default:
                if (IppTag.isCharacterString(tag)) {
                    writeString(value.asString(), out);
                } else {
                    byte[] bytes = value.rawBytes();
                    out.writeShort(bytes.length);
                    out.writeBytes(bytes);
                }
                break;
        }
    }

    private static void writeMember(IppAttribute member, ByteBuf out) {
        out.writeByte(IppTag.MEMBER_ATTR_NAME);
        out.writeShort(0);
        writeString(member.getName(), out);
        for (IppValue value : member.getValues()) {
            writeValue("", value, out);
        }
    }

    private static void writeString(String value, ByteBuf out) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeShort(bytes.length);
        out.writeBytes(bytes);
    }
}
