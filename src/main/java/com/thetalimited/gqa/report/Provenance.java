// Provenance.java
// software and host details stamped on every report

package com.thetalimited.gqa.report;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.gqa.correlation.RunRecord;

public final class Provenance
{
    private static final Logger LOG = LoggerFactory.getLogger(Provenance.class);

    static final String VERSION_RESOURCE = "/gqa.properties";
    static final String UNKNOWN = "unknown";

    private final String gqaVersion;
    private final String gverifyExecutable;
    private final String hostname;
    private final String operatingSystem;
    private final String runtimeId;
    private final OffsetDateTime timeProcessed;

    Provenance(String gqaVersion, String gverifyExecutable, String hostname, String operatingSystem,
               String runtimeId, OffsetDateTime timeProcessed)
    {
        this.gqaVersion = gqaVersion;
        this.gverifyExecutable = gverifyExecutable;
        this.hostname = hostname;
        this.operatingSystem = operatingSystem;
        this.runtimeId = runtimeId;
        this.timeProcessed = timeProcessed;
    }

    public static Provenance capture(String gverifyExecutable, Clock clock)
    {
        return new Provenance(version(), gverifyExecutable, hostname(),
                              System.getProperty("os.name") + " " + System.getProperty("os.version"),
                              UUID.randomUUID().toString(), OffsetDateTime.now(clock));
    }

    public String getGqaVersion() { return gqaVersion; }
    public String getGverifyExecutable() { return gverifyExecutable; }
    public String getHostname() { return hostname; }
    public String getOperatingSystem() { return operatingSystem; }
    public String getRuntimeId() { return runtimeId; }
    public OffsetDateTime getTimeProcessed() { return timeProcessed; }

    Map<String, Object> softwareVersions()
    {
        Map<String, Object> versions = new LinkedHashMap<>();
        versions.put("gqa", gqaVersion);
        versions.put("gverify", gverifyExecutable);
        return versions;
    }

    Map<String, Object> systemInformation()
    {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("hostname", hostname);
        info.put("os", operatingSystem);
        info.put("runtime_id", runtimeId);
        info.put("time_processed", RunRecord.formatDate(timeProcessed));
        return info;
    }

    static String version()
    {
        try (InputStream in = Provenance.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (in == null) {
                return UNKNOWN;
            }
            Properties props = new Properties();
            props.load(in);
            return props.getProperty("gqa.version", UNKNOWN);
        }
        catch (IOException e) {
            LOG.warn("Cannot read {}: {}", VERSION_RESOURCE, e.getMessage());
            return UNKNOWN;
        }
    }

    private static String hostname()
    {
        try {
            return InetAddress.getLocalHost().getHostName();
        }
        catch (UnknownHostException e) {
            LOG.debug("Local host name not resolvable: {}", e.getMessage());
            return UNKNOWN;
        }
    }
}
