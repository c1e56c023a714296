package com.telcobright.chunkschema.table;

import java.util.Map;
import java.util.Objects;

/**
 * A physical table that should exist for a periodic table family.
 * {@code active} marks tables currently receiving writes, including the grace
 * window around their period.
 */
public final class TableDesc {

    private final String name;
    private final Map<String, String> tags;
    private final boolean active;

    public TableDesc(String name, Map<String, String> tags, boolean active) {
        this.name = Objects.requireNonNull(name, "name");
        this.tags = tags == null ? Map.of() : Map.copyOf(tags);
        this.active = active;
    }

    public String getName() { return name; }
    public Map<String, String> getTags() { return tags; }
    public boolean isActive() { return active; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableDesc)) return false;
        TableDesc that = (TableDesc) o;
        return active == that.active && name.equals(that.name) && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tags, active);
    }

    @Override
    public String toString() {
        return String.format("TableDesc{name='%s', active=%s, tags=%s}", name, active, tags);
    }
}
