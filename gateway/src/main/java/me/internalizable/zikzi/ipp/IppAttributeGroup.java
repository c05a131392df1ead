package me.internalizable.zikzi.ipp;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Attributes following one delimiter tag, e.g. the operation or a job group.
 */
public final class IppAttributeGroup {

    private final int tag;
    private final List<IppAttribute> attributes = new ArrayList<>();

    public IppAttributeGroup(int tag) {
        if (!IppTag.isDelimiter(tag) || tag == IppTag.END) {
            throw new IllegalArgumentException(String.format("0x%02X is not a group tag", tag));
        }
        this.tag = tag;
    }

    public int getTag() {
        return tag;
    }

    @Nonnull
    public List<IppAttribute> getAttributes() {
        return ImmutableList.copyOf(attributes);
    }

    @Nonnull
    public Optional<IppAttribute> find(@Nonnull String name) {
        for (IppAttribute attribute : attributes) {
            if (attribute.getName().equals(name)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    @Nonnull
    public IppAttributeGroup add(@Nonnull IppAttribute attribute) {
        attributes.add(Objects.requireNonNull(attribute, "attribute"));
        return this;
    }

    @Nonnull
    public IppAttributeGroup add(@Nonnull String name, @Nonnull IppValue... values) {
        return add(new IppAttribute(name, values));
    }

    @Override
    public String toString() {
        return String.format("group 0x%02X ", tag) + attributes;
    }
}
