// CorrelationCommand.java
// command line and environment of a gverify run
//
//   gverify -b <reference> -m <source> -w <out> -l <out> -o <out>
//           -p <pyramid levels> -n <threads> -nv <null value>
//           -c <correlation> -r <NN|BI|CI> -cs <chip size>
//           ( -g <grid size> | -t FIXED_LOCATION -t_file <points> )

package com.thetalimited.gqa.correlation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.thetalimited.gqa.GqaConfig.CorrelationSettings;

public final class CorrelationCommand
{
    private final CorrelationSettings settings;

    public CorrelationCommand(CorrelationSettings settings)
    {
        this.settings = settings;
    }

    public static List<String> gridMode(int gridSize)
    {
        return List.of("-g", Integer.toString(gridSize));
    }

    public static List<String> fixedLocationMode(Path pointsFile)
    {
        return List.of("-t", "FIXED_LOCATION", "-t_file", pointsFile.toAbsolutePath().toString());
    }

    public List<String> arguments(Path reference, Path source, Path outDir, List<String> modeArguments)
    {
        String out = outDir.toAbsolutePath().toString();
        List<String> command = new ArrayList<>();
        command.add(settings.getExecutable());
        command.add("-b");
        command.add(reference.toAbsolutePath().toString());
        command.add("-m");
        command.add(source.toAbsolutePath().toString());
        command.add("-w");
        command.add(out);
        command.add("-l");
        command.add(out);
        command.add("-o");
        command.add(out);
        command.add("-p");
        command.add(Integer.toString(settings.getPyramidLevels()));
        command.add("-n");
        command.add(Integer.toString(settings.getThreadCount()));
        command.add("-nv");
        command.add(number(settings.getNullValue()));
        command.add("-c");
        command.add(number(settings.getCorrelationCoefficient()));
        command.add("-r");
        command.add(settings.getResampling());
        command.add("-cs");
        command.add(Integer.toString(settings.getChipSize()));
        command.addAll(modeArguments);
        return command;
    }

    /**
     * Variables gverify needs on top of the inherited environment. The
     * library path is prepended to any inherited LD_LIBRARY_PATH.
     */
    public Map<String, String> environment(Map<String, String> inherited)
    {
        Map<String, String> env = new LinkedHashMap<>();
        if (!settings.getLdLibraryPath().isEmpty()) {
            String current = inherited.get("LD_LIBRARY_PATH");
            env.put("LD_LIBRARY_PATH", current == null || current.isEmpty()
                    ? settings.getLdLibraryPath()
                    : settings.getLdLibraryPath() + ":" + current);
        }
        if (!settings.getGdalData().isEmpty()) {
            env.put("GDAL_DATA", settings.getGdalData());
        }
        if (!settings.getGeotiffCsv().isEmpty()) {
            env.put("GEOTIFF_CSV", settings.getGeotiffCsv());
        }
        return env;
    }

    // 0.0 -> "0", 0.75 -> "0.75"
    static String number(double value)
    {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
