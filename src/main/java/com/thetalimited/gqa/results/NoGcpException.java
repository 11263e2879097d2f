package com.thetalimited.gqa.results;

/**
 * The correlation results hold no ground control points.
 */
public class NoGcpException extends Exception
{
    private static final long serialVersionUID = 1L;

    public static final String MESSAGE = "no ground control points found";

    public NoGcpException(String detail)
    {
        super(MESSAGE + ": " + detail);
    }
}
