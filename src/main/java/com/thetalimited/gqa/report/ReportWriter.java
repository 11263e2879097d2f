// ReportWriter.java
// publishes a report so that readers of the output directory see either
// no report or a complete one: the document is written to a scratch file
// and moved into place

package com.thetalimited.gqa.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ReportWriter
{
    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    public Path publish(GqaReport report, Path scratchFile, Path destination) throws IOException
    {
        Files.createDirectories(scratchFile.toAbsolutePath().getParent());
        Files.writeString(scratchFile, report.toYaml(), StandardCharsets.UTF_8);

        Path targetDir = destination.toAbsolutePath().getParent();
        Files.createDirectories(targetDir);
        try {
            Files.move(scratchFile, destination, StandardCopyOption.ATOMIC_MOVE,
                       StandardCopyOption.REPLACE_EXISTING);
        }
        catch (AtomicMoveNotSupportedException e) {
            // different file systems: copy next to the destination, then rename there
            Path staged = Files.createTempFile(targetDir, destination.getFileName().toString(), ".part");
            try {
                Files.copy(scratchFile, staged, StandardCopyOption.REPLACE_EXISTING);
                Files.move(staged, destination, StandardCopyOption.ATOMIC_MOVE,
                           StandardCopyOption.REPLACE_EXISTING);
            }
            finally {
                Files.deleteIfExists(staged);
            }
            Files.deleteIfExists(scratchFile);
        }

        LOG.info("Published GQA report for {} to {}", report.getGranule(), destination);
        return destination;
    }
}
