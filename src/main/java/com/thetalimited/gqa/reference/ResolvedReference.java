package com.thetalimited.gqa.reference;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of reference resolution: the chosen images plus the provenance
 * reported for them. Provenance comes from the first chosen image.
 */
public final class ResolvedReference
{
    private final List<ReferenceImageRecord> images;
    private final Path sourceRoot;
    private final OffsetDateTime referenceDate;
    private final SpatialReferenceKey commonKey;

    ResolvedReference(List<ReferenceImageRecord> images, Path sourceRoot, OffsetDateTime referenceDate)
    {
        this.images = Collections.unmodifiableList(images);
        this.sourceRoot = sourceRoot;
        this.referenceDate = referenceDate;
        this.commonKey = SpatialReferenceKey.mostCommon(images);
    }

    public List<ReferenceImageRecord> getImages() { return images; }

    /** Repository root the first image was found in. */
    public Path getSourceRoot() { return sourceRoot; }

    public Path getSourcePath() { return images.get(0).getFile(); }
    public OffsetDateTime getReferenceDate() { return referenceDate; }
    public SpatialReferenceKey getCommonKey() { return commonKey; }

    /** Absolute {x, y} pixel size of the majority coordinate system. */
    public double[] getResolution() { return commonKey.absoluteResolution(); }
}
