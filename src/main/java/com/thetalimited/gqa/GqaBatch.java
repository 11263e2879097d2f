// GqaBatch.java
// runs many granules on a fixed pool of workers; every granule has its
// own scratch directory so nothing is shared between workers

package com.thetalimited.gqa;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.gqa.report.GqaReport;

public class GqaBatch
{
    private static final Logger LOG = LoggerFactory.getLogger(GqaBatch.class);

    /**
     * Produces the scene of a granule, e.g. by reading its manifest.
     */
    public interface SceneSource
    {
        String name();

        GranuleScene load() throws Exception;
    }

    private final GqaPipeline pipeline;
    private final int workers;

    public GqaBatch(GqaPipeline pipeline, int workers)
    {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive, got " + workers);
        }
        this.pipeline = pipeline;
        this.workers = workers;
    }

    public Summary run(List<SceneSource> sources, Path workRoot, Path outDir) throws InterruptedException
    {
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        Map<String, Future<GqaReport>> futures = new LinkedHashMap<>();
        try {
            for (SceneSource source : sources) {
                futures.put(source.name(), pool.submit(() -> pipeline.process(load(source), workRoot, outDir)));
            }

            Summary summary = new Summary();
            for (Map.Entry<String, Future<GqaReport>> entry : futures.entrySet()) {
                try {
                    GqaReport report = entry.getValue().get();
                    summary.reports.add(report);
                }
                catch (ExecutionException e) {
                    LOG.error("Granule {} aborted: {}", entry.getKey(), e.getCause().toString());
                    summary.aborted.put(entry.getKey(), e.getCause());
                }
            }
            return summary;
        }
        finally {
            pool.shutdownNow();
        }
    }

    // a granule counts as attempted once its scene loads; before that there
    // is no granule id to name a report after
    static GranuleScene load(SceneSource source) throws Exception
    {
        try {
            return source.load();
        }
        catch (Exception e) {
            LOG.error("Cannot load granule from {}, no report written: {}", source.name(), e.toString());
            throw e;
        }
    }

    public static final class Summary
    {
        private final List<GqaReport> reports = new ArrayList<>();
        private final Map<String, Throwable> aborted = new LinkedHashMap<>();

        /** Reports of the granules that completed, full or NaN. */
        public List<GqaReport> getReports() { return Collections.unmodifiableList(reports); }

        public Map<String, Throwable> getAborted() { return Collections.unmodifiableMap(aborted); }

        public long nanReports()
        {
            return reports.stream().filter(GqaReport::isNan).count();
        }

        @Override
        public String toString()
        {
            return reports.size() + " report(s) (" + nanReports() + " NaN), " + aborted.size() + " aborted";
        }
    }
}
