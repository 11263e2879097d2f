package com.thetalimited.gqa.reference;

import java.util.Objects;

/**
 * Path/row of a tile in the reference archive.
 */
public final class SceneIndexEntry
{
    private final int path;
    private final int row;

    public SceneIndexEntry(int path, int row)
    {
        this.path = path;
        this.row = row;
    }

    public int getPath() { return path; }
    public int getRow() { return row; }

    // zero padded, as used by the directory layout <root>/<path>/<row>
    public String pathDirectory() { return String.format("%03d", path); }
    public String rowDirectory() { return String.format("%03d", row); }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SceneIndexEntry)) {
            return false;
        }
        SceneIndexEntry other = (SceneIndexEntry) o;
        return path == other.path && row == other.row;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(path, row);
    }

    @Override
    public String toString()
    {
        return "{path=" + path + ", row=" + row + "}";
    }
}
