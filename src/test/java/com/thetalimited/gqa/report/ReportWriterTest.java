package com.thetalimited.gqa.report;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import com.thetalimited.gqa.correlation.RunRecord;

import static org.junit.Assert.*;

public class ReportWriterTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final GqaReportAssembler assembler = new GqaReportAssembler(2, Clock.systemUTC());

    @Test
    public void testPublishMovesScratchIntoPlace() throws Exception
    {
        Path scratch = folder.getRoot().toPath().resolve("work/G/gverify/G.gqa.yaml");
        Path destination = folder.getRoot().toPath().resolve("out/G.gqa.yaml");
        GqaReport report = assembler.nan(RunRecord.failed("gverify", "G", "No reference found"), "No reference found");

        Path published = new ReportWriter().publish(report, scratch, destination);

        assertEquals(destination, published);
        assertTrue(Files.isRegularFile(destination));
        assertFalse(Files.exists(scratch));

        Map<String, Object> doc = new Yaml(new SafeConstructor(new LoaderOptions()))
            .load(Files.readString(destination, StandardCharsets.UTF_8));
        assertEquals("G", doc.get("granule"));
        assertEquals("No reference found", doc.get("error_message"));
        Map<?, ?> residual = (Map<?, ?>) doc.get("residual");
        assertTrue(Double.isNaN((Double) residual.get("cep90")));
    }

    @Test
    public void testPublishReplacesExistingReport() throws Exception
    {
        Path scratch = folder.getRoot().toPath().resolve("scratch.yaml");
        Path destination = folder.newFile("G.gqa.yaml").toPath();
        Files.writeString(destination, "stale");

        new ReportWriter().publish(assembler.nan(RunRecord.failed("gverify", "G", "x"), "x"), scratch, destination);

        String content = Files.readString(destination);
        assertFalse(content.startsWith("stale"));
        assertTrue(content.contains("error_message: x"));
    }
}
