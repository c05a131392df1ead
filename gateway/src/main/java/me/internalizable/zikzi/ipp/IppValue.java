package me.internalizable.zikzi.ipp;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One value of an {@link IppAttribute}: the syntax tag plus the decoded content.
 *
 * <p>The content type follows the tag:</p>
 * <ul>
 *   <li>integer and enum: {@link Integer}</li>
 *   <li>boolean: {@link Boolean}</li>
 *   <li>character strings: {@link String}</li>
 *   <li>resolution, rangeOfInteger, text/nameWithLanguage: the nested types below</li>
 *   <li>collection: an immutable list of member {@link IppAttribute}s</li>
 *   <li>out-of-band: null</li>
 *   <li>octetString, dateTime and unknown syntaxes: the raw bytes</li>
 * </ul>
 */
public final class IppValue {

    private final int tag;
    private final Object value;
    // Same list as value for collections, null otherwise
    private final ImmutableList<IppAttribute> members;

    private IppValue(int tag, @Nullable Object value) {
        this.tag = tag;
        this.value = value;
        this.members = null;
    }

    private IppValue(@Nonnull ImmutableList<IppAttribute> members) {
        this.tag = IppTag.BEGIN_COLLECTION;
        this.value = members;
        this.members = members;
    }

    // ==================== Factories ====================

    public static IppValue integer(int value) {
        return new IppValue(IppTag.INTEGER, value);
    }

    public static IppValue enumValue(int value) {
        return new IppValue(IppTag.ENUM, value);
    }

    public static IppValue bool(boolean value) {
        return new IppValue(IppTag.BOOLEAN, value);
    }

    public static IppValue keyword(@Nonnull String value) {
        return string(IppTag.KEYWORD, value);
    }

    public static IppValue text(@Nonnull String value) {
        return string(IppTag.TEXT, value);
    }

    public static IppValue name(@Nonnull String value) {
        return string(IppTag.NAME, value);
    }

    public static IppValue uri(@Nonnull String value) {
        return string(IppTag.URI, value);
    }

    public static IppValue charset(@Nonnull String value) {
        return string(IppTag.CHARSET, value);
    }

    public static IppValue naturalLanguage(@Nonnull String value) {
        return string(IppTag.NATURAL_LANGUAGE, value);
    }

    public static IppValue mimeMediaType(@Nonnull String value) {
        return string(IppTag.MIME_MEDIA_TYPE, value);
    }

    public static IppValue string(int tag, @Nonnull String value) {
        if (!IppTag.isCharacterString(tag)) {
            throw new IllegalArgumentException(String.format("Tag 0x%02X is not a string syntax", tag));
        }
        return new IppValue(tag, Objects.requireNonNull(value, "value"));
    }

    public static IppValue octets(int tag, @Nonnull byte[] value) {
        return new IppValue(tag, value.clone());
    }

    public static IppValue outOfBand(int tag) {
        if (!IppTag.isOutOfBand(tag)) {
            throw new IllegalArgumentException(String.format("Tag 0x%02X is not out-of-band", tag));
        }
        return new IppValue(tag, null);
    }

    public static IppValue resolution(int crossFeed, int feed, int units) {
        return new IppValue(IppTag.RESOLUTION, new Resolution(crossFeed, feed, units));
    }

    public static IppValue range(int lower, int upper) {
        return new IppValue(IppTag.RANGE, new Range(lower, upper));
    }

    public static IppValue withLanguage(int tag, @Nonnull String language, @Nonnull String text) {
        if (tag != IppTag.TEXT_WITH_LANGUAGE && tag != IppTag.NAME_WITH_LANGUAGE) {
            throw new IllegalArgumentException(String.format("Tag 0x%02X does not carry a language", tag));
        }
        return new IppValue(tag, new StringWithLanguage(language, text));
    }

    public static IppValue collection(@Nonnull List<IppAttribute> members) {
        return new IppValue(ImmutableList.copyOf(members));
    }

    // ==================== Accessors ====================

    public int getTag() {
        return tag;
    }

    @Nullable
    public Object getValue() {
        return value instanceof byte[] ? ((byte[]) value).clone() : value;
    }

    /**
     * Returns the value as text. Strings are returned as-is, language-tagged strings
     * without their language, anything else through {@link String#valueOf(Object)}.
     */
    @Nonnull
    public String asString() {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof StringWithLanguage) {
            return ((StringWithLanguage) value).getText();
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return String.valueOf(value);
    }

    /**
     * @throws IllegalStateException if the value is not an integer or enum
     */
    public int asInt() {
        if (!(value instanceof Integer)) {
            throw new IllegalStateException(String.format("Value with tag 0x%02X is not numeric", tag));
        }
        return (Integer) value;
    }

    @Nonnull
    public List<IppAttribute> asCollection() {
        if (members == null) {
            throw new IllegalStateException(String.format("Value with tag 0x%02X is not a collection", tag));
        }
        return members;
    }

    public boolean isOutOfBand() {
        return IppTag.isOutOfBand(tag);
    }

    byte[] rawBytes() {
        return (byte[]) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IppValue)) return false;
        IppValue that = (IppValue) o;
        if (tag != that.tag) return false;
        if (value instanceof byte[] && that.value instanceof byte[]) {
            return Arrays.equals((byte[]) value, (byte[]) that.value);
        }
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * tag + (value instanceof byte[] ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value));
    }

    @Override
    public String toString() {
        return String.format("0x%02X:", tag) + (value instanceof byte[] ? ((byte[]) value).length + " bytes" : value);
    }

    // ==================== Structured Syntaxes ====================

    public static final class Resolution {
        private final int crossFeed;
        private final int feed;
        private final int units;

        public Resolution(int crossFeed, int feed, int units) {
            this.crossFeed = crossFeed;
            this.feed = feed;
            this.units = units;
        }

        public int getCrossFeed() { return crossFeed; }
        public int getFeed() { return feed; }
        public int getUnits() { return units; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Resolution)) return false;
            Resolution that = (Resolution) o;
            return crossFeed == that.crossFeed && feed == that.feed && units == that.units;
        }

        @Override
        public int hashCode() {
            return Objects.hash(crossFeed, feed, units);
        }

        @Override
        public String toString() {
            return crossFeed + "x" + feed + (units == 3 ? "dpi" : "dpcm");
        }
    }

    public static final class Range {
        private final int lower;
        private final int upper;

        public Range(int lower, int upper) {
            this.lower = lower;
            this.upper = upper;
        }

        public int getLower() { return lower; }
        public int getUpper() { return upper; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Range)) return false;
            Range that = (Range) o;
            return lower == that.lower && upper == that.upper;
        }

        @Override
        public int hashCode() {
            return Objects.hash(lower, upper);
        }

        @Override
        public String toString() {
            return lower + "-" + upper;
        }
    }

    public static final class StringWithLanguage {
        private final String language;
        private final String text;

        public StringWithLanguage(@Nonnull String language, @Nonnull String text) {
            this.language = Objects.requireNonNull(language, "language");
            this.text = Objects.requireNonNull(text, "text");
        }

        public String getLanguage() { return language; }
        public String getText() { return text; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof StringWithLanguage)) return false;
            StringWithLanguage that = (StringWithLanguage) o;
            return language.equals(that.language) && text.equals(that.text);
        }

        @Override
        public int hashCode() {
            return Objects.hash(language, text);
        }

        @Override
        public String toString() {
            return text + " [" + language + "]";
        }
    }
}
