package com.thetalimited.gqa.results;

/**
 * One candidate ground control point reported by gverify. Residuals are
 * in map units.
 */
public final class CorrelationPoint
{
    public static final int RELIABLE = 1;

    private final String pointId;
    private final int chip;
    private final double line;
    private final double sample;
    private final double mapX;
    private final double mapY;
    private final double correlation;
    private final double yResidual;
    private final double xResidual;
    private final int outlierFlag;

    public CorrelationPoint(String pointId, int chip, double line, double sample, double mapX, double mapY,
                            double correlation, double yResidual, double xResidual, int outlierFlag)
    {
        this.pointId = pointId;
        this.chip = chip;
        this.line = line;
        this.sample = sample;
        this.mapX = mapX;
        this.mapY = mapY;
        this.correlation = correlation;
        this.yResidual = yResidual;
        this.xResidual = xResidual;
        this.outlierFlag = outlierFlag;
    }

    public String getPointId() { return pointId; }
    public int getChip() { return chip; }
    public double getLine() { return line; }
    public double getSample() { return sample; }
    public double getMapX() { return mapX; }
    public double getMapY() { return mapY; }
    public double getCorrelation() { return correlation; }
    public double getYResidual() { return yResidual; }
    public double getXResidual() { return xResidual; }
    public int getOutlierFlag() { return outlierFlag; }

    // gverify flags the points it trusts with 1
    public boolean isReliable() { return outlierFlag == RELIABLE; }

    @Override
    public String toString()
    {
        return "point " + pointId + " corr=" + correlation + " dx=" + xResidual + " dy=" + yResidual
            + " flag=" + outlierFlag;
    }
}
