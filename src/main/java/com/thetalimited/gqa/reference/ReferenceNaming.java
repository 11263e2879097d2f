// ReferenceNaming.java
// acquisition dates embedded in reference image file names
//
// primary archive:  <sat:3><path+row:6><year+doy:7>...._<band>
//                   e.g. LE70900812000235ASA00_B3.TIF
// backup archive:   p<path:3>r<row:3>????<yyyymmdd>_z<zone:2>_<band:2>
//                   e.g. p090r081_7dt20000822_z55_30.tif
//
// a file only counts for an acquisition when its band token is the one
// the band maps assign to the acquisition's sensor and band id

package com.thetalimited.gqa.reference;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.thetalimited.gqa.GqaConfig.BandMaps;

public final class ReferenceNaming
{
    private static final Pattern PRIMARY = Pattern.compile(
        "(?<sat>[A-Z0-9]{3})(?<pathrow>[0-9]{6})(?<yeardoy>[0-9]{7})[^_]+_(?<band>\\w+)");

    private static final Pattern BACKUP = Pattern.compile(
        "p(?<path>[0-9]{3})r(?<row>[0-9]{3}).{4}(?<yyyymmdd>[0-9]{8})_z(?<zone>[0-9]{2})_(?<band>[0-9]{2})");

    private static final DateTimeFormatter YYYYMMDD = DateTimeFormatter.ofPattern("uuuuMMdd");

    private final BandMaps bandMaps;

    public ReferenceNaming(BandMaps bandMaps)
    {
        this.bandMaps = bandMaps;
    }

    /**
     * Acquisition date of a reference file name, at midnight UTC, or empty
     * when the name follows neither convention or carries another band.
     */
    public Optional<OffsetDateTime> referenceDate(String filename, String bandId, String sensor)
    {
        Matcher m = PRIMARY.matcher(filename);
        if (m.lookingAt()) {
            String expected = bandMaps.primaryBand(m.group("sat"), sensor, bandId);
            if (m.group("band").equals(expected)) {
                Optional<OffsetDateTime> date = julianDate(m.group("yeardoy"));
                if (date.isPresent()) {
                    return date;
                }
            }
        }

        m = BACKUP.matcher(filename);
        if (m.lookingAt() && m.group("band").equals(bandMaps.backupBand(sensor, bandId))) {
            try {
                LocalDate day = LocalDate.parse(m.group("yyyymmdd"), YYYYMMDD);
                return Optional.of(day.atStartOfDay().atOffset(ZoneOffset.UTC));
            }
            catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }

        return Optional.empty();
    }

    // year followed by zero padded day of year, e.g. 2000235
    private static Optional<OffsetDateTime> julianDate(String yearDoy)
    {
        int year = Integer.parseInt(yearDoy.substring(0, 4));
        int doy = Integer.parseInt(yearDoy.substring(4));
        try {
            return Optional.of(LocalDate.ofYearDay(year, doy).atStartOfDay().atOffset(ZoneOffset.UTC));
        }
        catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
