package work.vaultlogic.sandbox.helpers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.vaultlogic.sandbox.helpers.HelperTestSupport.call;

import org.junit.jupiter.api.Test;

class DateHelpersTest {
    private static final HelperNamespace NS = HelperNamespace.DATE;

    @Test
    void nowUsesLibraryClock() {
        assertEquals("2025-06-01T12:30:45.123Z", call(NS, "now"));
    }

    @Test
    void addsAndSubtracts() {
        assertEquals("2025-01-06T00:00:00.000Z", call(NS, "add", "2025-01-01T00:00:00.000Z", 5, "days"));
        assertEquals("2025-03-15T00:00:00.000Z", call(NS, "subtract", "2025-06-15T00:00:00.000Z", 3, "months"));
        assertEquals("2025-01-01T02:00:00.000Z", call(NS, "add", "2025-01-01", 2, "hours"));
        assertEquals("2024-02-29T00:00:00.000Z", call(NS, "add", "2023-02-28T00:00:00Z", 366, "days"));
    }

    @Test
    void offsetsAreNormalizedToUtc() {
        assertEquals("2025-01-01T09:00:00.000Z", call(NS, "add", "2025-01-01T10:00:00+02:00", 1, "hours"));
    }

    @Test
    void formatsWithPattern() {
        assertEquals("2025-12-07", call(NS, "format", "2025-12-07T15:30:00.000Z", "yyyy-MM-dd"));
        assertEquals("15:30", call(NS, "format", "2025-12-07T15:30:00.000Z", "HH:mm"));
    }

    @Test
    void parsesWithAndWithoutPattern() {
        assertEquals("2025-12-07T00:00:00.000Z", call(NS, "parse", "12/07/2025", "MM/dd/yyyy"));
        assertEquals("2024-05-01T00:00:00.000Z", call(NS, "parse", "2024-05-01"));
    }

    @Test
    void diffIsSecondMinusFirst() {
        assertEquals(9, call(NS, "diff", "2025-01-01T00:00:00.000Z", "2025-01-10T00:00:00.000Z", "days"));
        assertEquals(-9, call(NS, "diff", "2025-01-10T00:00:00.000Z", "2025-01-01T00:00:00.000Z", "days"));
        assertEquals(36, call(NS, "diff", "2025-01-01T00:00:00Z", "2025-01-02T12:30:00Z", "hours"));
    }

    @Test
    void invalidInputIsReportedAsInvalidDate() {
        assertEquals("Invalid Date", call(NS, "add", "invalid-date", 5, "days"));
        assertEquals("Invalid Date", call(NS, "add", "2025-01-01", 5, "weeks"));
        assertEquals("Invalid Date", call(NS, "format", "nope", "yyyy"));
        assertEquals("Invalid Date", call(NS, "parse", "31/31/2025", "MM/dd/yyyy"));
        assertEquals(0, call(NS, "diff", "nope", "2025-01-01", "days"));
    }
}
