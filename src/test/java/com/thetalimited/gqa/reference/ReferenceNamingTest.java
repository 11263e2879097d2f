package com.thetalimited.gqa.reference;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.junit.Test;

import com.thetalimited.gqa.GqaConfig;

import static org.junit.Assert.*;

public class ReferenceNamingTest
{
    private final ReferenceNaming naming = new ReferenceNaming(GqaConfig.defaults().getBandMaps());

    private static OffsetDateTime utc(int year, int month, int day)
    {
        return OffsetDateTime.of(year, month, day, 0, 0, 0, 0, ZoneOffset.UTC);
    }

    @Test
    public void testPrimaryNameUsesJulianDay()
    {
        Optional<OffsetDateTime> date = naming.referenceDate("LE70900812000235ASA00_B3.TIF", "4", "SENTINEL_2A");
        assertEquals(Optional.of(utc(2000, 8, 22)), date);
    }

    @Test
    public void testPrimaryBandDependsOnReferenceSatellite()
    {
        // LC8 carries band 4 as B4, LE7 as B3
        assertTrue(naming.referenceDate("LC80900812015001LGN00_B4.TIF", "4", "SENTINEL_2A").isPresent());
        assertFalse(naming.referenceDate("LC80900812015001LGN00_B3.TIF", "4", "SENTINEL_2A").isPresent());
        assertFalse(naming.referenceDate("LE70900812000235ASA00_B4.TIF", "4", "SENTINEL_2A").isPresent());
    }

    @Test
    public void testBackupNameUsesCalendarDate()
    {
        Optional<OffsetDateTime> date = naming.referenceDate("p090r081_7dt20000822_z55_30.tif", "4", "SENTINEL_2A");
        assertEquals(Optional.of(utc(2000, 8, 22)), date);

        assertFalse(naming.referenceDate("p090r081_7dt20000822_z55_10.tif", "4", "SENTINEL_2A").isPresent());
        assertTrue(naming.referenceDate("p090r081_7dt20000822_z55_10.tif", "2", "SENTINEL_2A").isPresent());
    }

    @Test
    public void testUnknownNamesAndSensors()
    {
        assertFalse(naming.referenceDate("readme.tif", "4", "SENTINEL_2A").isPresent());
        assertFalse(naming.referenceDate("LE70900812000235ASA00_B3.TIF", "4", "WORLDVIEW_2").isPresent());
        assertFalse(naming.referenceDate("LE70900812000235ASA00_B3.TIF", "7", "SENTINEL_2A").isPresent());
    }

    @Test
    public void testInvalidDatesAreSkipped()
    {
        assertFalse(naming.referenceDate("LE70900812000400ASA00_B3.TIF", "4", "SENTINEL_2A").isPresent());
        assertFalse(naming.referenceDate("p090r081_7dt20001332_z55_30.tif", "4", "SENTINEL_2A").isPresent());
    }
}
