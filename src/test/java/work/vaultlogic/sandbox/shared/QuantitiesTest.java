package work.vaultlogic.sandbox.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class QuantitiesTest {
    @Test
    void parsesMilliseconds() {
        assertEquals(Duration.ofMillis(250), Quantities.parseDuration("250ms").orElseThrow());
    }

    @Test
    void parsesSecondsAndMinutes() {
        assertEquals(Duration.ofSeconds(2), Quantities.parseDuration("2s").orElseThrow());
        assertEquals(Duration.ofMinutes(1), Quantities.parseDuration("1m").orElseThrow());
    }

    @Test
    void bareNumberIsMilliseconds() {
        assertEquals(Duration.ofMillis(1500), Quantities.parseDuration(" 1500 ").orElseThrow());
    }

    @Test
    void blankDurationIsAbsent() {
        assertTrue(Quantities.parseDuration("  ").isEmpty());
        assertTrue(Quantities.parseDuration(null).isEmpty());
    }

    @Test
    void parsesByteSizes() {
        assertEquals(64L * 1024, Quantities.parseByteSize("64kb").getAsLong());
        assertEquals(128L * 1024 * 1024, Quantities.parseByteSize("128MB").getAsLong());
        assertEquals(1024L * 1024 * 1024, Quantities.parseByteSize("1gb").getAsLong());
        assertEquals(512L, Quantities.parseByteSize("512b").getAsLong());
        assertEquals(4096L, Quantities.parseByteSize("4096").getAsLong());
    }

    @Test
    void rejectsGarbageAndNegatives() {
        assertThrows(IllegalArgumentException.class, () -> Quantities.parseDuration("soon"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parseByteSize("-1kb"));
    }
}
