package in.co.kundli.astro;

import in.co.kundli.services.ChartServiceConfig;

import java.util.List;

/**
 * Rahu and Ketu from the Moon's sidereal longitude.
 * The descending node is placed on the Moon itself and the ascending node opposite it; both regress at a fixed nominal rate.
 */
public class LunarNodeCalculator {

    private LunarNodeCalculator() {
    }

    /**
     * @return Rahu then Ketu, houses unassigned
     */
    public static List<PlanetPosition> fromMoon(PlanetPosition moon) {
        if (moon.getBody() != Body.MOON) {
            throw new IllegalArgumentException("Lunar nodes need the Moon, got " + moon.getBody());
        }
        return fromMoonLongitude(moon.getLongitude());
    }

    public static List<PlanetPosition> fromMoonLongitude(double moonLongitude) {
        PlanetPosition rahu = PlanetPosition.of(Body.RAHU, moonLongitude + Angles.HALF_CIRCLE, ChartServiceConfig.LUNAR_NODE_SPEED, true);
        PlanetPosition ketu = PlanetPosition.of(Body.KETU, moonLongitude, ChartServiceConfig.LUNAR_NODE_SPEED, true);
        return List.of(rahu, ketu);
    }
}
