// GeographicDomain.java
// inclusive path/row window of the reference archive; scenes outside
// of it have no reference imagery and are never searched

package com.thetalimited.gqa.reference;

import java.util.ArrayList;
import java.util.List;

public final class GeographicDomain
{
    private final int minPath, maxPath;
    private final int minRow, maxRow;

    public GeographicDomain(int minPath, int maxPath, int minRow, int maxRow)
    {
        if (minPath > maxPath || minRow > maxRow) {
            throw new IllegalArgumentException("Empty path/row domain: path " + minPath + ".." + maxPath
                                               + ", row " + minRow + ".." + maxRow);
        }
        this.minPath = minPath;
        this.maxPath = maxPath;
        this.minRow = minRow;
        this.maxRow = maxRow;
    }

    public boolean contains(SceneIndexEntry entry)
    {
        return entry.getPath() >= minPath && entry.getPath() <= maxPath
            && entry.getRow() >= minRow && entry.getRow() <= maxRow;
    }

    public List<SceneIndexEntry> restrict(List<SceneIndexEntry> entries)
    {
        List<SceneIndexEntry> inside = new ArrayList<>();
        for (SceneIndexEntry entry : entries) {
            if (contains(entry)) {
                inside.add(entry);
            }
        }
        return inside;
    }

    @Override
    public String toString()
    {
        return "path " + minPath + ".." + maxPath + ", row " + minRow + ".." + maxRow;
    }
}
