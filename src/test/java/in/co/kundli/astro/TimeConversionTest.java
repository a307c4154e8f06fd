package in.co.kundli.astro;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class TimeConversionTest {

    private static final double DELTA = 1e-6;

    @Test
    public void test_j2000Epoch() {
        assertEquals(2451545.0, TimeConversion.toJulianDate(LocalDateTime.of(2000, 1, 1, 12, 0)), DELTA);
    }

    @Test
    public void test_midnightEndsInHalfDay() {
        assertEquals(2448724.5, TimeConversion.toJulianDate(LocalDateTime.of(1992, 4, 12, 0, 0)), DELTA);
    }

    @Test
    public void test_januaryCountsAsMonth13OfPreviousYear() {
        assertEquals(2446822.5, TimeConversion.toJulianDate(LocalDateTime.of(1987, 1, 27, 0, 0)), DELTA);
    }

    @Test
    public void test_fractionalDayFromClockTime() {
        // Sputnik 1 launch, 1957 Oct 4.81
        assertEquals(2436116.31, TimeConversion.toJulianDate(LocalDateTime.of(1957, 10, 4, 19, 26, 24)), DELTA);
    }

    @Test
    public void test_zonedAndInstantOverloadsAgreeWithUtc() {
        ZonedDateTime delhi = ZonedDateTime.of(2000, 1, 1, 17, 30, 0, 0, ZoneOffset.ofHoursMinutes(5, 30));
        assertEquals(2451545.0, TimeConversion.toJulianDate(delhi), DELTA);
        assertEquals(2451545.0, TimeConversion.toJulianDate(Instant.parse("2000-01-01T12:00:00Z")), DELTA);
    }

    @Test
    public void test_fromJulianDate_inverse() {
        assertEquals(Instant.parse("2000-01-01T12:00:00Z"), TimeConversion.fromJulianDate(2451545.0));
        assertEquals(Instant.parse("1992-04-12T00:00:00Z"), TimeConversion.fromJulianDate(2448724.5));
    }

    @Test
    public void test_julianCenturies() {
        assertEquals(0.0, TimeConversion.julianCenturies(TimeConversion.J2000), DELTA);
        assertEquals(1.0, TimeConversion.julianCenturies(TimeConversion.J2000 + 36525.0), DELTA);
    }

    @Test
    public void test_greenwichSiderealTime_atJ2000() {
        assertEquals(18.697374558, TimeConversion.greenwichSiderealTime(LocalDateTime.of(2000, 1, 1, 12, 0)), DELTA);
    }

    @Test
    public void test_greenwichSiderealTime_reducedModulo24() {
        // half a day later the raw value passes 24h
        assertEquals(6.73022947, TimeConversion.greenwichSiderealTime(2451545.5), DELTA);
    }

    @Test
    public void test_localSiderealTime_addsLongitudeInHours() {
        assertEquals(23.844641225, TimeConversion.localSiderealTime(LocalDateTime.of(2000, 1, 1, 12, 0), 77.2090), DELTA);
        assertEquals(17.697374558, TimeConversion.localSiderealTime(2451545.0, -15.0), DELTA);
    }

    @Test
    public void test_localSiderealTime_wrapsPast24() {
        double lst = TimeConversion.localSiderealTime(2451545.0, 180.0);
        assertEquals(6.697374558, lst, DELTA);
    }
}
