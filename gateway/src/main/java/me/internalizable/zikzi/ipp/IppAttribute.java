package me.internalizable.zikzi.ipp;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A named attribute with one or more values.
 */
public final class IppAttribute {

    private final String name;
    private final List<IppValue> values = new ArrayList<>();

    public IppAttribute(@Nonnull String name, @Nonnull IppValue... values) {
        this.name = Objects.requireNonNull(name, "name");
        this.values.addAll(Arrays.asList(values));
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public List<IppValue> getValues() {
        return ImmutableList.copyOf(values);
    }

    /**
     * The first value, or null for an attribute without values.
     */
    @Nullable
    public IppValue getFirst() {
        return values.isEmpty() ? null : values.get(0);
    }

    public void addValue(@Nonnull IppValue value) {
        values.add(Objects.requireNonNull(value, "value"));
    }

    int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IppAttribute)) return false;
        IppAttribute that = (IppAttribute) o;
        return name.equals(that.name) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, values);
    }

    @Override
    public String toString() {
        return name + "=" + values;
    }
}
