package com.example.dataingest.support;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Issues {@code ingestion_yyyyMMdd_HHmmss} identifiers, suffixed with {@code _N} when several runs
 * start within the same second.
 */
@Component
public class SessionIdGenerator {

    private static final String PREFIX = "ingestion_";
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;

    private String lastStamp;
    private int sequence;

    @Autowired
    public SessionIdGenerator() {
        this(Clock.systemDefaultZone());
    }

    public SessionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public synchronized String nextSessionId() {
        String stamp = LocalDateTime.now(clock).format(FORMAT);
        if (stamp.equals(lastStamp)) {
            sequence++;
            return PREFIX + stamp + "_" + sequence;
        }
        lastStamp = stamp;
        sequence = 0;
        return PREFIX + stamp;
    }
}
