// ReferenceImageryResolver.java
// finds the reference image(s) a granule is correlated against:
//   footprint -> intersecting path/rows -> restricted to the archive's
//   domain -> first repository holding the path/row -> image closest in
//   time carrying the matching band

package com.thetalimited.gqa.reference;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.gqa.GqaConfig;

public class ReferenceImageryResolver
{
    private static final Logger LOG = LoggerFactory.getLogger(ReferenceImageryResolver.class);

    private final SceneIndex sceneIndex;
    private final GeographicDomain domain;
    private final List<Path> repositories;
    private final Pattern extensions;
    private final ReferenceNaming naming;
    private final SpatialReferenceReader reader;

    public ReferenceImageryResolver(SceneIndex sceneIndex, GqaConfig config, SpatialReferenceReader reader)
    {
        this(sceneIndex,
             config.getReferences().getDomain(),
             config.getReferences().getDirectories(),
             config.getReferences().getExtensions(),
             new ReferenceNaming(config.getBandMaps()),
             reader);
    }

    public ReferenceImageryResolver(SceneIndex sceneIndex, GeographicDomain domain, List<Path> repositories,
                                    Pattern extensions, ReferenceNaming naming, SpatialReferenceReader reader)
    {
        this.sceneIndex = sceneIndex;
        this.domain = domain;
        this.repositories = List.copyOf(repositories);
        this.extensions = extensions;
        this.naming = naming;
        this.reader = reader;
    }

    /**
     * Path/rows of the scene index intersecting the footprint.
     *
     * @throws ResolutionException if there are none
     */
    public List<SceneIndexEntry> intersecting(Footprint footprint) throws ResolutionException
    {
        List<SceneIndexEntry> entries = sceneIndex.intersecting(footprint);
        if (entries.isEmpty()) {
            throw new ResolutionException("No intersecting scenes found for footprint " + footprint);
        }
        return entries;
    }

    public ResolvedReference resolve(Footprint footprint, OffsetDateTime timestamp, String bandId, String sensor)
        throws ResolutionException, IOException
    {
        return resolve(intersecting(footprint), timestamp, bandId, sensor);
    }

    public ResolvedReference resolve(List<SceneIndexEntry> entries, OffsetDateTime timestamp,
                                     String bandId, String sensor)
        throws ResolutionException, IOException
    {
        List<SceneIndexEntry> candidates = domain.restrict(entries);
        if (candidates.isEmpty()) {
            throw new ResolutionException("No path/row within " + domain + " among " + entries);
        }

        List<Path> found = new ArrayList<>();
        Path firstRoot = null;
        for (SceneIndexEntry entry : candidates) {
            Optional<Path> root = referenceRootFor(entry);
            if (root.isEmpty()) {
                LOG.info("No reference directory for {} in any of {}", entry, repositories);
                continue;
            }

            Path folder = folderFor(root.get(), entry);
            Optional<Path> closest = closestMatch(folder, listNames(folder), timestamp, bandId, sensor);
            if (closest.isPresent()) {
                if (firstRoot == null) {
                    firstRoot = root.get();
                }
                found.add(closest.get());
            }
        }

        if (found.isEmpty()) {
            throw new ResolutionException("No reference found for " + entries);
        }

        List<ReferenceImageRecord> images = new ArrayList<>();
        for (Path file : found) {
            images.add(reader.read(file));
        }

        Path first = images.get(0).getFile();
        OffsetDateTime referenceDate = naming.referenceDate(first.getFileName().toString(), bandId, sensor)
            .orElseThrow(() -> new IllegalStateException("Lost reference date of " + first));

        ResolvedReference resolved = new ResolvedReference(images, firstRoot, referenceDate);
        LOG.info("Reference imagery for {}: {} image(s), first {} dated {}",
                 candidates, images.size(), first, referenceDate.toLocalDate());
        return resolved;
    }

    /**
     * First repository, in priority order, with a directory for the
     * path/row.
     */
    public Optional<Path> referenceRootFor(SceneIndexEntry entry)
    {
        for (Path repository : repositories) {
            if (Files.isDirectory(folderFor(repository, entry))) {
                return Optional.of(repository);
            }
        }
        return Optional.empty();
    }

    /**
     * The file in {@code names} closest in time to {@code timestamp}. On a
     * tie the name listed first wins, so the result follows the order the
     * directory listing returned.
     */
    Optional<Path> closestMatch(Path folder, List<String> names, OffsetDateTime timestamp,
                                String bandId, String sensor)
    {
        String best = null;
        Duration bestDelta = null;
        for (String name : names) {
            if (!extensions.matcher(name).matches()) {
                continue;
            }
            Optional<OffsetDateTime> date = naming.referenceDate(name, bandId, sensor);
            if (date.isEmpty()) {
                continue;
            }
            Duration delta = Duration.between(date.get(), timestamp).abs();
            if (bestDelta == null || delta.compareTo(bestDelta) < 0) {
                best = name;
                bestDelta = delta;
            }
        }
        return best == null ? Optional.empty() : Optional.of(folder.resolve(best));
    }

    private static Path folderFor(Path repository, SceneIndexEntry entry)
    {
        return repository.resolve(entry.pathDirectory()).resolve(entry.rowDirectory());
    }

    // raw directory order, the same order a plain listing reports
    private static List<String> listNames(Path folder) throws IOException
    {
        String[] names = folder.toFile().list();
        if (names == null) {
            throw new IOException("Cannot list reference directory " + folder);
        }
        return Collections.unmodifiableList(Arrays.asList(names));
    }
}
