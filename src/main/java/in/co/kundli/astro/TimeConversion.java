package in.co.kundli.astro;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Calendar and sidereal time conversions.
 * Acronyms used:
 * JD   Julian Date
 * GST  Greenwich Sidereal Time
 * LST  Local Sidereal Time
 * UT   Universal Time (UTC is taken as UT)
 */
public class TimeConversion {

    /** Jan 1, 2000, 12:00 UT */
    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_JULIAN_CENTURY = 36525.0;

    private static final double UNIX_EPOCH_JD = 2440587.5;
    private static final double SECONDS_PER_DAY = 86400.0;

    private TimeConversion() {
    }

    /**
     * Gregorian calendar date/time to Julian Date. A zone-less date/time is taken as UTC.
     */
    public static double toJulianDate(LocalDateTime utc) {
        int year = utc.getYear();
        int month = utc.getMonthValue();
        int day = utc.getDayOfMonth();

        // January and February count as months 13 and 14 of the previous year
        if (month <= 2) {
            year -= 1;
            month += 12;
        }

        int a = (int) Math.floor(year / 100.0);
        int b = 2 - a + (int) Math.floor(a / 4.0);

        double jd = Math.floor(365.25 * (year + 4716)) + Math.floor(30.6001 * (month + 1)) + day + b - 1524.5;

        double dayFraction = (utc.getHour() + utc.getMinute() / 60.0 + (utc.getSecond() + utc.getNano() / 1e9) / 3600.0) / 24.0;
        return jd + dayFraction;
    }

    public static double toJulianDate(ZonedDateTime dateTime) {
        return toJulianDate(dateTime.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }

    public static double toJulianDate(Instant instant) {
        return toJulianDate(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    /**
     * Julian Date back to a UTC instant, rounded to the millisecond.
     */
    public static Instant fromJulianDate(double julianDate) {
        long millis = Math.round((julianDate - UNIX_EPOCH_JD) * SECONDS_PER_DAY * 1000.0);
        return Instant.ofEpochMilli(millis);
    }

    /**
     * Julian centuries elapsed since J2000.
     */
    public static double julianCenturies(double julianDate) {
        return (julianDate - J2000) / DAYS_PER_JULIAN_CENTURY;
    }

    /**
     * Greenwich mean sidereal time in hours, [0, 24).
     */
    public static double greenwichSiderealTime(LocalDateTime utc) {
        return greenwichSiderealTime(toJulianDate(utc));
    }

    public static double greenwichSiderealTime(double julianDate) {
        double daysSinceJ2000 = julianDate - J2000;
        return Angles.modulo(18.697374558 + 24.06570982441908 * daysSinceJ2000, 24.0);
    }

    /**
     * Local sidereal time in hours, [0, 24). East longitudes are positive.
     */
    public static double localSiderealTime(LocalDateTime utc, double longitude) {
        return localSiderealTime(toJulianDate(utc), longitude);
    }

    public static double localSiderealTime(double julianDate, double longitude) {
        // 1 degree of longitude = 4 minutes of time
        return Angles.modulo(greenwichSiderealTime(julianDate) + longitude / 15.0, 24.0);
    }
}
