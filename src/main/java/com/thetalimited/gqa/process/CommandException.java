package com.thetalimited.gqa.process;

/**
 * An external command exited with a non-zero status or ran past its
 * timeout.
 */
public class CommandException extends Exception
{
    private static final long serialVersionUID = 1L;

    private final boolean timedOut;

    public CommandException(String message, boolean timedOut)
    {
        super(message);
        this.timedOut = timedOut;
    }

    public CommandException(String message, Throwable cause)
    {
        super(message, cause);
        this.timedOut = false;
    }

    public boolean isTimedOut() { return timedOut; }
}
