// GqaMain.java
// command line entry point
//
//   GqaMain <config.json> <workdir> <outdir> <granule-manifest.json>...

package com.thetalimited.gqa;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class GqaMain
{
    public static void main(String[] args) throws Exception
    {
        if (args.length < 4) {
            System.out.println("Usage: GqaMain <config.json> <workdir> <outdir> <granule-manifest.json>...");
            System.exit(-1);
        }

        GqaConfig config = GqaConfig.load(Paths.get(args[0]));
        Path workDir = Paths.get(args[1]);
        Path outDir = Paths.get(args[2]);

        List<GqaBatch.SceneSource> sources = new ArrayList<>();
        for (int i = 3; i < args.length; i++) {
            Path manifest = Paths.get(args[i]);
            sources.add(new GqaBatch.SceneSource() {
                    @Override
                    public String name() { return manifest.toString(); }

                    @Override
                    public GranuleScene load() throws Exception { return GranuleManifest.load(manifest); }
                });
        }

        int workers = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        GqaBatch.Summary summary = new GqaBatch(GqaPipeline.create(config), workers).run(sources, workDir, outDir);

        System.out.println(summary);
        if (!summary.getAborted().isEmpty()) {
            System.exit(1);
        }
    }
}
