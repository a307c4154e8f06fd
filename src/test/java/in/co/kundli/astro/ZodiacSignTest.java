package in.co.kundli.astro;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class ZodiacSignTest {

    @ParameterizedTest
    @CsvSource({
            "0, Aries",
            "29.9999, Aries",
            "30, Taurus",
            "120, Leo",
            "270, Capricorn",
            "359.9999, Pisces"
    })
    public void test_fromLongitude(double longitude, String expected) {
        assertEquals(expected, ZodiacSign.fromLongitude(longitude).getDisplayName());
    }

    @Test
    public void test_signIndexIsFloorOfLongitudeOver30() {
        for (double longitude = 0.0; longitude < 360.0; longitude += 0.25) {
            int expected = (int) Math.floor(longitude / 30.0) % 12;
            assertEquals(expected, ZodiacSign.indexOf(longitude), "longitude " + longitude);
        }
    }

    @Test
    public void test_fromIndex_wraps() {
        assertEquals(ZodiacSign.ARIES, ZodiacSign.fromIndex(12));
        assertEquals(ZodiacSign.PISCES, ZodiacSign.fromIndex(-1));
        assertEquals(ZodiacSign.TAURUS, ZodiacSign.PISCES.plus(2));
    }

    @Test
    public void test_degreeInSign() {
        assertEquals(15.5, ZodiacSign.degreeInSign(45.5), 1e-9);
        assertEquals(0.0, ZodiacSign.degreeInSign(300.0), 1e-9);
    }

    @Test
    public void test_referenceData() {
        assertEquals(12, ZodiacSign.values().length);
        assertEquals(Body.MARS, ZodiacSign.ARIES.getLord());
        assertEquals(Body.SATURN, ZodiacSign.AQUARIUS.getLord());
        assertEquals(Body.JUPITER, ZodiacSign.PISCES.getLord());
        assertEquals(ZodiacSign.Element.WATER, ZodiacSign.CANCER.getElement());
        assertEquals(ZodiacSign.Quality.FIXED, ZodiacSign.LEO.getQuality());
        assertEquals("Makara", ZodiacSign.CAPRICORN.getRashi());
        assertEquals(270.0, ZodiacSign.CAPRICORN.getStartLongitude(), 1e-9);
    }
}
