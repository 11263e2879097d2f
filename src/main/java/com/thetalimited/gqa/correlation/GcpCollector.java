package com.thetalimited.gqa.correlation;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.gqa.reference.SceneIndexEntry;

/**
 * Concatenates the known ground control points of several path/rows,
 * stored as {@code <root>/<path>/<row>/points.txt}, into one points file.
 */
public class GcpCollector
{
    private static final Logger LOG = LoggerFactory.getLogger(GcpCollector.class);

    public static final String POINTS_FILE = "points.txt";

    /**
     * @return number of lines written
     */
    public long collect(Path fixRoot, List<SceneIndexEntry> entries, Path resultFile) throws IOException
    {
        long lines = 0;
        try (BufferedWriter out = Files.newBufferedWriter(resultFile, StandardCharsets.UTF_8)) {
            for (SceneIndexEntry entry : entries) {
                Path points = fixRoot.resolve(entry.pathDirectory()).resolve(entry.rowDirectory()).resolve(POINTS_FILE);
                if (!Files.isRegularFile(points)) {
                    throw new NoSuchFileException(points.toString(), null, "no fixed GCP list for " + entry);
                }
                LOG.debug("Collecting GCPs from {} {}", entry.pathDirectory(), entry.rowDirectory());
                for (String line : Files.readAllLines(points, StandardCharsets.UTF_8)) {
                    out.write(line);
                    out.newLine();
                    lines++;
                }
            }
        }
        return lines;
    }
}
