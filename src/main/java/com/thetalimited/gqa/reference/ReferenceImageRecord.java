package com.thetalimited.gqa.reference;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A reference image file together with its spatial reference key. Grouping
 * by coordinate system is done on {@link #getKey()}, never on the record.
 */
public final class ReferenceImageRecord
{
    private final Path file;
    private final SpatialReferenceKey key;

    public ReferenceImageRecord(Path file, SpatialReferenceKey key)
    {
        this.file = Objects.requireNonNull(file, "file");
        this.key = Objects.requireNonNull(key, "key");
    }

    public Path getFile() { return file; }
    public SpatialReferenceKey getKey() { return key; }

    public boolean sharesReferenceWith(SpatialReferenceKey other)
    {
        return key.equals(other);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReferenceImageRecord)) {
            return false;
        }
        ReferenceImageRecord other = (ReferenceImageRecord) o;
        return file.equals(other.file) && key.equals(other.key);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(file, key);
    }

    @Override
    public String toString()
    {
        return file + " " + key;
    }
}
