package in.co.kundli.astro;

/**
 * Geocentric Moon from the principal periodic terms of the ELP-2000/82 series as tabulated by Meeus.
 * Longitude is referred to the mean equinox of date; nutation is not applied.
 */
class LunarTheory {

    static final double KM_PER_AU = 149597870.7;

    // multipliers of D, M, M', F followed by the longitude (1e-6 deg) and distance (1e-3 km) coefficients
    private static final double[][] LONGITUDE_DISTANCE_TERMS = {
            {0, 0, 1, 0, 6288774, -20905355},
            {2, 0, -1, 0, 1274027, -3699111},
            {2, 0, 0, 0, 658314, -2955968},
            {0, 0, 2, 0, 213618, -569925},
            {0, 1, 0, 0, -185116, 48888},
            {0, 0, 0, 2, -114332, -3149},
            {2, 0, -2, 0, 58793, 246158},
            {2, -1, -1, 0, 57066, -152138},
            {2, 0, 1, 0, 53322, -170733},
            {2, -1, 0, 0, 45758, -204586},
            {0, 1, -1, 0, -40923, -129620},
            {1, 0, 0, 0, -34720, 108743},
            {0, 1, 1, 0, -30383, 104755},
            {2, 0, 0, -2, 15327, 10321},
            {0, 0, 1, 2, -12528, 0},
            {0, 0, 1, -2, 10980, 79661},
            {4, 0, -1, 0, 10675, -34782},
            {0, 0, 3, 0, 10034, -23210},
            {4, 0, -2, 0, 8548, -21636},
            {2, 1, -1, 0, -7888, 24208},
            {2, 1, 0, 0, -6766, 30824},
            {1, 0, -1, 0, -5163, -8379},
            {1, 1, 0, 0, 4987, -16675},
            {2, -1, 1, 0, 4036, -12831},
            {2, 0, 2, 0, 3994, -10445},
            {4, 0, 0, 0, 3861, -11650},
            {2, 0, -3, 0, 3665, 14403},
            {0, 1, -2, 0, -2689, -7003},
            {2, 0, -1, 2, -2602, 0},
            {2, -1, -2, 0, 2390, 10056},
            {1, 0, 1, 0, -2348, 6322},
            {2, -2, 0, 0, 2236, -9884},
    };

    // multipliers of D, M, M', F followed by the latitude coefficient (1e-6 deg)
    private static final double[][] LATITUDE_TERMS = {
            {0, 0, 0, 1, 5128122},
            {0, 0, 1, 1, 280602},
            {0, 0, 1, -1, 277693},
            {2, 0, 0, -1, 173237},
            {2, 0, -1, 1, 55413},
            {2, 0, -1, -1, 46271},
            {2, 0, 0, 1, 32573},
            {0, 0, 2, 1, 17198},
            {2, 0, 1, -1, 9266},
            {0, 0, 2, -1, 8822},
            {2, -1, 0, -1, 8216},
            {2, 0, -2, -1, 4324},
            {2, 0, 1, 1, 4200},
    };

    private LunarTheory() {
    }

    static EclipticPosition position(double julianDate) {
        double t = TimeConversion.julianCenturies(julianDate);

        double meanLongitude = Angles.normalize(218.3164477 + 481267.88123421 * t);
        double elongation = Angles.normalize(297.8501921 + 445267.1114034 * t);
        double sunAnomaly = Angles.normalize(357.5291092 + 35999.0502909 * t);
        double moonAnomaly = Angles.normalize(134.9633964 + 477198.8675055 * t);
        double argumentOfLatitude = Angles.normalize(93.2720950 + 483202.0175233 * t);

        double a1 = Angles.normalize(119.75 + 131.849 * t);
        double a2 = Angles.normalize(53.09 + 479264.290 * t);
        double a3 = Angles.normalize(313.45 + 481266.484 * t);

        // decreasing eccentricity of the Earth's orbit
        double e = 1 - 0.002516 * t - 0.0000074 * t * t;

        double sumLongitude = 0;
        double sumDistance = 0;
        for (double[] term : LONGITUDE_DISTANCE_TERMS) {
            double argument = term[0] * elongation + term[1] * sunAnomaly + term[2] * moonAnomaly + term[3] * argumentOfLatitude;
            double factor = eccentricityFactor(term[1], e);
            sumLongitude += term[4] * factor * Angles.sin(argument);
            sumDistance += term[5] * factor * Angles.cos(argument);
        }
        sumLongitude += 3958 * Angles.sin(a1) + 1962 * Angles.sin(meanLongitude - argumentOfLatitude) + 318 * Angles.sin(a2);

        double sumLatitude = 0;
        for (double[] term : LATITUDE_TERMS) {
            double argument = term[0] * elongation + term[1] * sunAnomaly + term[2] * moonAnomaly + term[3] * argumentOfLatitude;
            sumLatitude += term[4] * eccentricityFactor(term[1], e) * Angles.sin(argument);
        }
        sumLatitude += -2235 * Angles.sin(meanLongitude)
                + 382 * Angles.sin(a3)
                + 175 * Angles.sin(a1 - argumentOfLatitude)
                + 175 * Angles.sin(a1 + argumentOfLatitude)
                + 127 * Angles.sin(meanLongitude - moonAnomaly)
                - 115 * Angles.sin(meanLongitude + moonAnomaly);

        double longitude = meanLongitude + sumLongitude / 1e6;
        double latitude = sumLatitude / 1e6;
        double distanceKm = 385000.56 + sumDistance / 1000.0;
        return new EclipticPosition(longitude, latitude, distanceKm / KM_PER_AU);
    }

    private static double eccentricityFactor(double sunAnomalyMultiplier, double e) {
        int power = (int) Math.abs(sunAnomalyMultiplier);
        return power == 0 ? 1.0 : Math.pow(e, power);
    }
}
