package com.thetalimited.gqa.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs an external command to completion.
 */
public interface CommandRunner
{
    long NO_TIMEOUT = 0L;

    /**
     * @param command        executable followed by its arguments
     * @param workDir        working directory of the process
     * @param environment    variables added to the inherited environment
     * @param timeoutSeconds upper bound on the run time, {@link #NO_TIMEOUT} for none
     */
    void run(List<String> command, Path workDir, Map<String, String> environment, long timeoutSeconds)
        throws CommandException, IOException;
}
