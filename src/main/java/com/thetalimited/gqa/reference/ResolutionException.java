package com.thetalimited.gqa.reference;

/**
 * No usable reference imagery could be found for a granule.
 */
public class ResolutionException extends Exception
{
    private static final long serialVersionUID = 1L;

    public ResolutionException(String message)
    {
        super(message);
    }
}
