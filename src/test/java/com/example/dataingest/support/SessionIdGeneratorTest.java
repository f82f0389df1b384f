package com.example.dataingest.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class SessionIdGeneratorTest {

    @Test
    void shouldFormatSessionIdFromClock() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-17T09:05:03Z"), ZoneOffset.UTC);

        assertEquals("ingestion_20261017_090503", new SessionIdGenerator(clock).nextSessionId());
    }

    @Test
    void shouldSuffixRunsWithinTheSameSecond() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-17T09:05:03Z"), ZoneOffset.UTC);
        SessionIdGenerator generator = new SessionIdGenerator(clock);

        assertEquals("ingestion_20261017_090503", generator.nextSessionId());
        assertEquals("ingestion_20261017_090503_1", generator.nextSessionId());
        assertEquals("ingestion_20261017_090503_2", generator.nextSessionId());
    }

    @Test
    void shouldProduceDistinctIdsForBackToBackRuns() {
        SessionIdGenerator generator = new SessionIdGenerator();

        String first = generator.nextSessionId();
        String second = generator.nextSessionId();

        assertNotEquals(first, second);
        assertTrue(first.startsWith("ingestion_"));
    }
}
