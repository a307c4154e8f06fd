package in.co.kundli.astro;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HouseSystemTest {

    private static final double DELTA = 1e-9;

    private static ChartAngles angles(double ascendant, double midheaven) {
        return new ChartAngles(ascendant, midheaven, 0.0, 0.0);
    }

    // =========================================================================
    // Whole sign
    // =========================================================================

    @Test
    public void test_wholeSign_firstHouseIsAscendantSign() {
        List<HouseCusp> cusps = HouseSystem.WHOLE_SIGN.cusps(angles(45.3, 300.0));
        assertEquals(ZodiacSign.TAURUS, cusps.get(0).getSign());
        assertEquals(30.0, cusps.get(0).getLongitude(), DELTA);
        assertEquals(0.0, cusps.get(11).getLongitude(), DELTA);
        assertEquals(ZodiacSign.ARIES, cusps.get(11).getSign());
    }

    @Test
    public void test_wholeSign_wrapsPastPisces() {
        List<HouseCusp> cusps = HouseSystem.WHOLE_SIGN.cusps(angles(355.0, 265.0));
        assertEquals(330.0, cusps.get(0).getLongitude(), DELTA);
        assertEquals(0.0, cusps.get(1).getLongitude(), DELTA);
        assertEquals(300.0, cusps.get(11).getLongitude(), DELTA);
    }

    @Test
    public void test_wholeSign_cuspsAreMultiplesOf30() {
        for (double ascendant = 0.0; ascendant < 360.0; ascendant += 7.3) {
            for (HouseCusp cusp : HouseSystem.WHOLE_SIGN.cusps(angles(ascendant, 0.0))) {
                assertEquals(0.0, cusp.getLongitude() % 30.0, DELTA);
            }
        }
    }

    // =========================================================================
    // Approximate Placidus
    // =========================================================================

    @Test
    public void test_placidus_angularHousesSitOnTheAngles() {
        List<HouseCusp> cusps = HouseSystem.PLACIDUS.cusps(angles(10.0, 280.0));
        assertEquals(10.0, cusps.get(0).getLongitude(), DELTA);   // ascendant
        assertEquals(100.0, cusps.get(3).getLongitude(), DELTA);  // IC
        assertEquals(190.0, cusps.get(6).getLongitude(), DELTA);  // descendant
        assertEquals(280.0, cusps.get(9).getLongitude(), DELTA);  // midheaven
    }

    @Test
    public void test_placidus_intermediateCuspsTrisectLinearly() {
        List<HouseCusp> cusps = HouseSystem.PLACIDUS.cusps(angles(10.0, 250.0));
        // IC at 70: 10 -> 70
        assertEquals(30.0, cusps.get(1).getLongitude(), DELTA);
        assertEquals(50.0, cusps.get(2).getLongitude(), DELTA);
        // descendant at 190: 70 -> 190
        assertEquals(110.0, cusps.get(4).getLongitude(), DELTA);
        assertEquals(150.0, cusps.get(5).getLongitude(), DELTA);
        // 190 -> 250
        assertEquals(210.0, cusps.get(7).getLongitude(), DELTA);
        assertEquals(230.0, cusps.get(8).getLongitude(), DELTA);
        // 250 -> 10 is a difference of -240, so houses 11 and 12 step backwards
        assertEquals(170.0, cusps.get(10).getLongitude(), DELTA);
        assertEquals(90.0, cusps.get(11).getLongitude(), DELTA);
    }

    @Test
    public void test_placidus_descendingQuadrant_usesSignedDifference() {
        // IC at 30: 300 -> 30 is a difference of -270
        List<HouseCusp> cusps = HouseSystem.PLACIDUS.cusps(angles(300.0, 210.0));
        assertEquals(300.0, cusps.get(0).getLongitude(), DELTA);
        assertEquals(210.0, cusps.get(1).getLongitude(), DELTA);
        assertEquals(120.0, cusps.get(2).getLongitude(), DELTA);
        assertEquals(30.0, cusps.get(3).getLongitude(), DELTA);
        // 30 -> 120 -> 210 -> 300 all ascend
        assertEquals(60.0, cusps.get(4).getLongitude(), DELTA);
        assertEquals(90.0, cusps.get(5).getLongitude(), DELTA);
        assertEquals(240.0, cusps.get(10).getLongitude(), DELTA);
        assertEquals(270.0, cusps.get(11).getLongitude(), DELTA);
    }

    @Test
    public void test_placidus_ascendantNearZero() {
        // IC at 80: 350 -> 80 is a difference of -270
        List<HouseCusp> cusps = HouseSystem.PLACIDUS.cusps(angles(350.0, 260.0));
        assertEquals(350.0, cusps.get(0).getLongitude(), DELTA);
        assertEquals(260.0, cusps.get(1).getLongitude(), DELTA);
        assertEquals(170.0, cusps.get(2).getLongitude(), DELTA);
        assertEquals(80.0, cusps.get(3).getLongitude(), DELTA);
        // 260 -> 350 ascends
        assertEquals(290.0, cusps.get(10).getLongitude(), DELTA);
        assertEquals(320.0, cusps.get(11).getLongitude(), DELTA);
    }

    // =========================================================================
    // Both systems
    // =========================================================================

    @ParameterizedTest
    @EnumSource(HouseSystem.class)
    public void test_twelveHousesNumberedInOrder(HouseSystem system) {
        for (double ascendant = 0.5; ascendant < 360.0; ascendant += 23.0) {
            List<HouseCusp> cusps = system.cusps(angles(ascendant, Angles.normalize(ascendant - 95.0)));
            assertEquals(12, cusps.size());
            for (int i = 0; i < cusps.size(); i++) {
                assertEquals(i + 1, cusps.get(i).getHouse());
                double longitude = cusps.get(i).getLongitude();
                assertTrue(longitude >= 0.0 && longitude < 360.0, "cusp " + longitude);
            }
            assertEquals(ZodiacSign.fromLongitude(ascendant), cusps.get(0).getSign());
        }
    }

    @Test
    public void test_requestValueParsing() {
        assertEquals(HouseSystem.WHOLE_SIGN, HouseSystem.fromRequestValue("whole_sign"));
        assertEquals(HouseSystem.PLACIDUS, HouseSystem.fromRequestValue("PLACIDUS"));
        assertThrows(IllegalArgumentException.class, () -> HouseSystem.fromRequestValue("koch"));
    }
}
