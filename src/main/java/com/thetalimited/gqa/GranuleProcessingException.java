package com.thetalimited.gqa;

/**
 * A granule hit a failure its stages do not capture. Its NaN report has
 * been published already when this is thrown, unless publishing itself
 * failed.
 */
public class GranuleProcessingException extends Exception
{
    private static final long serialVersionUID = 1L;

    private final String granule;

    public GranuleProcessingException(String granule, Throwable cause)
    {
        super("Processing of " + granule + " aborted: " + cause, cause);
        this.granule = granule;
    }

    public String getGranule() { return granule; }
}
