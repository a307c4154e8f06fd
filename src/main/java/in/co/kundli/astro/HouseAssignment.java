package in.co.kundli.astro;

import in.co.kundli.services.LoggingService;

import java.util.ArrayList;
import java.util.List;

/**
 * Places bodies into houses for a given cusp set.
 */
public class HouseAssignment {

    private HouseAssignment() {
    }

    public static List<PlanetPosition> assign(List<PlanetPosition> positions, List<HouseCusp> cusps, HouseSystem system) {
        if (cusps.size() != HouseSystem.HOUSE_COUNT) {
            throw new IllegalArgumentException("Expected 12 cusps, got " + cusps.size());
        }
        List<PlanetPosition> assigned = new ArrayList<>(positions.size());
        for (PlanetPosition position : positions) {
            assigned.add(position.withHouse(houseOf(position, cusps, system)));
        }
        return assigned;
    }

    public static int houseOf(PlanetPosition position, List<HouseCusp> cusps, HouseSystem system) {
        if (system == HouseSystem.WHOLE_SIGN) {
            return wholeSignHouse(position.getSign(), cusps.get(0).getSign());
        }
        return cuspIntervalHouse(position.getLongitude(), cusps);
    }

    static int wholeSignHouse(ZodiacSign bodySign, ZodiacSign firstHouseSign) {
        return Math.floorMod(bodySign.getIndex() - firstHouseSign.getIndex(), ZodiacSign.COUNT) + 1;
    }

    /**
     * First house whose [cusp, next cusp) arc holds the longitude; house 1 if none does.
     */
    static int cuspIntervalHouse(double longitude, List<HouseCusp> cusps) {
        for (int i = 0; i < cusps.size(); i++) {
            HouseCusp cusp = cusps.get(i);
            HouseCusp next = cusps.get((i + 1) % cusps.size());
            if (Angles.inHalfOpenArc(longitude, cusp.getLongitude(), next.getLongitude())) {
                return cusp.getHouse();
            }
        }
        LoggingService.warn("house_assignment_fallback", LoggingService.data("longitude", longitude));
        return 1;
    }
}
