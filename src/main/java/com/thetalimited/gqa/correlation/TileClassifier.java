// TileClassifier.java
// land/ocean classification of a granule by its tile id; ocean tiles are
// listed one per line in the ocean tile list, everything else is land

package com.thetalimited.gqa.correlation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

public final class TileClassifier
{
    private final Set<String> oceanTiles;

    public TileClassifier(Collection<String> oceanTiles)
    {
        this.oceanTiles = new HashSet<>();
        for (String tile : oceanTiles) {
            this.oceanTiles.add(tile.strip());
        }
    }

    public static TileClassifier load(Path oceanTileList) throws IOException
    {
        return new TileClassifier(Files.readAllLines(oceanTileList, StandardCharsets.UTF_8));
    }

    /**
     * Tile id of a granule name: the second last '_' separated token
     * without its leading letter, e.g. T52KGA -> 52KGA.
     */
    public static String tileId(String granule)
    {
        String[] tokens = granule.split("_", -1);
        if (tokens.length < 2 || tokens[tokens.length - 2].length() < 2) {
            throw new IllegalArgumentException("No tile id in granule name " + granule);
        }
        return tokens[tokens.length - 2].substring(1);
    }

    public boolean isOcean(String granule)
    {
        return oceanTiles.contains(tileId(granule));
    }

    public boolean isLand(String granule)
    {
        return !isOcean(granule);
    }
}
