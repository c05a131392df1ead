package me.internalizable.zikzi.ipp;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An IPP request or response without its document data.
 *
 * <p>{@code code} is the operation id of a request or the status code of a response.</p>
 */
public final class IppMessage {

    private final int majorVersion;
    private final int minorVersion;
    private final int code;
    private final int requestId;
    private final List<IppAttributeGroup> groups = new ArrayList<>();

    public IppMessage(int majorVersion, int minorVersion, int code, int requestId) {
        this.majorVersion = majorVersion;
        this.minorVersion = minorVersion;
        this.code = code;
        this.requestId = requestId;
    }

    /**
     * Creates an IPP 2.0 response carrying the mandatory charset and language attributes.
     */
    @Nonnull
    public static IppMessage response(int status, int requestId) {
        IppMessage response = new IppMessage(2, 0, status, requestId);
        response.addGroup(IppTag.OPERATION)
            .add("attributes-charset", IppValue.charset("utf-8"))
            .add("attributes-natural-language", IppValue.naturalLanguage("en"));
        return response;
    }

    public int getMajorVersion() {
        return majorVersion;
    }

    public int getMinorVersion() {
        return minorVersion;
    }

    public int getCode() {
        return code;
    }

    public int getRequestId() {
        return requestId;
    }

    @Nonnull
    public List<IppAttributeGroup> getGroups() {
        return ImmutableList.copyOf(groups);
    }

    /**
     * Appends a new group. Groups with the same tag may repeat, e.g. one job group per job.
     */
    @Nonnull
    public IppAttributeGroup addGroup(int tag) {
        IppAttributeGroup group = new IppAttributeGroup(tag);
        groups.add(group);
        return group;
    }

    /**
     * Returns the first group with the given tag.
     */
    @Nonnull
    public Optional<IppAttributeGroup> getGroup(int tag) {
        for (IppAttributeGroup group : groups) {
            if (group.getTag() == tag) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first value of an operation attribute as text.
     */
    @Nonnull
    public Optional<String> getOperationString(@Nonnull String name) {
        return getGroup(IppTag.OPERATION)
            .flatMap(group -> group.find(name))
            .map(IppAttribute::getFirst)
            .filter(value -> !value.isOutOfBand())
            .map(IppValue::asString);
    }

    @Override
    public String toString() {
        return "IppMessage{version=" + majorVersion + "." + minorVersion +
                ", code=" + String.format("0x%04X", code) +
                ", requestId=" + requestId +
                ", groups=" + groups.size() +
                '}';
    }
}
