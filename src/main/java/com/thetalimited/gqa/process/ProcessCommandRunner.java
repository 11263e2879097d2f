// ProcessCommandRunner.java
// blocking subprocess execution; stdout and stderr are appended to
// <workDir>/<executable>.log

package com.thetalimited.gqa.process;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProcessCommandRunner implements CommandRunner
{
    private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public void run(List<String> command, Path workDir, Map<String, String> environment, long timeoutSeconds)
        throws CommandException, IOException
    {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Empty command");
        }

        String executable = Paths.get(command.get(0)).getFileName().toString();
        Path log = workDir.resolve(executable + ".log");

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        pb.environment().putAll(environment);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(log.toFile()));

        LOG.debug("Running {} in {}", String.join(" ", command), workDir);
        Process p;
        try {
            p = pb.start();
        }
        catch (IOException e) {
            // executable missing or not runnable
            throw new CommandException("Cannot run '" + executable + "': " + e.getMessage(), e);
        }

        try {
            if (timeoutSeconds == NO_TIMEOUT) {
                p.waitFor();
            }
            else if (!p.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                p.waitFor(5, TimeUnit.SECONDS);
                throw new CommandException("Command '" + executable + "' timed out after "
                                           + timeoutSeconds + " seconds", true);
            }
        }
        catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandException("Interrupted while waiting for '" + executable + "'", e);
        }

        int exit = p.exitValue();
        if (exit != 0) {
            throw new CommandException("Command '" + executable + "' returned non-zero exit status "
                                       + exit + " (see " + log + ")", false);
        }
    }
}
