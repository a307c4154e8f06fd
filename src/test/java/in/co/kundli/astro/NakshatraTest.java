package in.co.kundli.astro;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class NakshatraTest {

    @ParameterizedTest
    @CsvSource({
            "0, Ashwini",
            "30, Krittika",
            "120, Magha",
            "270, Uttara Ashadha",
            "359.99, Revati"
    })
    public void test_fromLongitude(double longitude, String expected) {
        assertEquals(expected, Nakshatra.fromLongitude(longitude).getDisplayName());
    }

    @Test
    public void test_zeroDegreesIsFirstPadaOfAshwini() {
        assertEquals(Nakshatra.ASHWINI, Nakshatra.fromLongitude(0.0));
        assertEquals(1, Nakshatra.padaOf(0.0));
    }

    @Test
    public void test_padaBoundaries() {
        double pada = 360.0 / 108.0;
        assertEquals(1, Nakshatra.padaOf(pada - 1e-9));
        assertEquals(2, Nakshatra.padaOf(pada + 1e-9));
        assertEquals(3, Nakshatra.padaOf(2 * pada + 1e-9));
        assertEquals(4, Nakshatra.padaOf(Nakshatra.SPAN - 1e-9));
        assertEquals(1, Nakshatra.padaOf(Nakshatra.SPAN + 1e-9));
    }

    @Test
    public void test_indexAndPadaFormulasHoldAroundTheCircle() {
        double span = 360.0 / 27.0;
        for (double longitude = 0.0; longitude < 360.0; longitude += 0.1) {
            assertEquals((int) Math.floor(longitude / span) % 27, Nakshatra.indexOf(longitude), "longitude " + longitude);
            int pada = Nakshatra.padaOf(longitude);
            assertTrue(pada >= 1 && pada <= 4, "pada " + pada + " at " + longitude);
        }
    }

    @Test
    public void test_lordsFollowVimshottariCycle() {
        assertEquals(27, Nakshatra.values().length);
        for (Nakshatra nakshatra : Nakshatra.values()) {
            assertEquals(Nakshatra.fromIndex(nakshatra.getIndex() + 9).getLord(), nakshatra.getLord(), nakshatra.getDisplayName());
        }
        assertEquals(Body.KETU, Nakshatra.MAGHA.getLord());
        assertEquals(Body.SUN, Nakshatra.UTTARA_ASHADHA.getLord());
    }

    @Test
    public void test_deities() {
        assertEquals("Ashwini Kumaras", Nakshatra.ASHWINI.getDeity());
        assertEquals("Brahma", Nakshatra.ROHINI.getDeity());
        assertEquals("Pitris", Nakshatra.MAGHA.getDeity());
        assertEquals("Indra-Agni", Nakshatra.VISHAKHA.getDeity());
        assertEquals("Vishve Devas", Nakshatra.UTTARA_ASHADHA.getDeity());
        assertEquals("Pushan", Nakshatra.REVATI.getDeity());
        assertEquals("Pushan", Nakshatra.fromLongitude(359.9).getDeity());
        for (Nakshatra nakshatra : Nakshatra.values()) {
            assertFalse(nakshatra.getDeity().isBlank(), nakshatra.name());
        }
    }
}
