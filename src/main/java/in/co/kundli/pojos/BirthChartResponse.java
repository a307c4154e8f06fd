package in.co.kundli.pojos;

import in.co.kundli.astro.Angles;
import in.co.kundli.astro.AyanamshaResult;
import in.co.kundli.astro.ChartAngles;
import in.co.kundli.astro.HouseCusp;
import in.co.kundli.astro.Nakshatra;
import in.co.kundli.astro.PlanetPosition;
import in.co.kundli.astro.ZodiacSign;
import in.co.kundli.services.ChartServiceConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized birth chart. Degree values are rounded to {@link ChartServiceConfig#DEGREE_SCALE} places;
 * longitudes are normalized again after rounding so 359.9999999 becomes 0.
 */
public class BirthChartResponse {
    private final boolean success = true;
    private Map<String, Object> input;
    private double ascendant;
    private String ascendantSign;
    private double midheaven;
    private double ayanamsha;
    private String ayanamshaSystem;
    private String houseSystem;
    private List<Planet> planets;
    private List<House> houses;
    private List<String> warnings;

    public BirthChartResponse() {
    }

    public static BirthChartResponse from(BirthMoment moment, AyanamshaResult ayanamsha, ChartAngles angles,
                                          List<PlanetPosition> positions, List<HouseCusp> cusps, List<String> warnings) {
        BirthChartResponse response = new BirthChartResponse();
        response.input = echo(moment);
        response.ascendant = roundLongitude(angles.getAscendant());
        response.ascendantSign = ZodiacSign.fromLongitude(response.ascendant).getDisplayName();
        response.midheaven = roundLongitude(angles.getMidheaven());
        response.ayanamsha = round(ayanamsha.getValue());
        response.ayanamshaSystem = ayanamsha.getApplied().getRequestValue();
        response.houseSystem = moment.getHouseSystem().getRequestValue();
        response.planets = new ArrayList<>();
        for (PlanetPosition position : positions) {
            response.planets.add(Planet.from(position));
        }
        response.houses = new ArrayList<>();
        for (HouseCusp cusp : cusps) {
            double degree = roundLongitude(cusp.getLongitude());
            response.houses.add(new House(cusp.getHouse(), ZodiacSign.fromLongitude(degree).getDisplayName(), degree));
        }
        response.warnings = new ArrayList<>(warnings);
        return response;
    }

    private static Map<String, Object> echo(BirthMoment moment) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("year", moment.getLocalDateTime().getYear());
        input.put("month", moment.getLocalDateTime().getMonthValue());
        input.put("date", moment.getLocalDateTime().getDayOfMonth());
        input.put("hours", moment.getLocalDateTime().getHour());
        input.put("minutes", moment.getLocalDateTime().getMinute());
        input.put("seconds", moment.getLocalDateTime().getSecond());
        input.put("latitude", moment.getLatitude());
        input.put("longitude", moment.getLongitude());
        input.put("timezone", moment.getUtcOffsetHours());
        input.put("observation_point", moment.getObservationPoint().getRequestValue());
        input.put("ayanamsha", moment.getAyanamsha().getRequestValue());
        input.put("house_system", moment.getHouseSystem().getRequestValue());
        return input;
    }

    static double round(double value) {
        return Angles.round(value, ChartServiceConfig.DEGREE_SCALE);
    }

    static double roundLongitude(double longitude) {
        return Angles.roundLongitude(longitude, ChartServiceConfig.DEGREE_SCALE);
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    public double getAscendant() {
        return ascendant;
    }

    public String getAscendantSign() {
        return ascendantSign;
    }

    public double getMidheaven() {
        return midheaven;
    }

    public double getAyanamsha() {
        return ayanamsha;
    }

    public String getAyanamshaSystem() {
        return ayanamshaSystem;
    }

    public String getHouseSystem() {
        return houseSystem;
    }

    public List<Planet> getPlanets() {
        return planets;
    }

    public List<House> getHouses() {
        return houses;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public static class Planet {
        private String name;
        private double fullDegree;
        private double normDegree;
        private double speed;
        private boolean isRetro;
        private String sign;
        private String signLord;
        private String nakshatra;
        private String nakshatraLord;
        private int nakshatraPada;
        private int house;

        public Planet() {
        }

        static Planet from(PlanetPosition position) {
            Planet planet = new Planet();
            planet.name = position.getBody().getDisplayName();
            // sign and nakshatra follow the reported degree, so 29.9999997 reads as 30.0 Taurus
            double longitude = roundLongitude(position.getLongitude());
            ZodiacSign sign = ZodiacSign.fromLongitude(longitude);
            Nakshatra nakshatra = Nakshatra.fromLongitude(longitude);
            planet.fullDegree = longitude;
            planet.normDegree = round(ZodiacSign.degreeInSign(longitude));
            planet.speed = round(position.getSpeed());
            planet.isRetro = position.isRetrograde();
            planet.sign = sign.getDisplayName();
            planet.signLord = sign.getLord().getDisplayName();
            planet.nakshatra = nakshatra.getDisplayName();
            planet.nakshatraLord = nakshatra.getLord().getDisplayName();
            planet.nakshatraPada = Nakshatra.padaOf(longitude);
            planet.house = position.getHouse();
            return planet;
        }

        public String getName() {
            return name;
        }

        public double getFullDegree() {
            return fullDegree;
        }

        public double getNormDegree() {
            return normDegree;
        }

        public double getSpeed() {
            return speed;
        }

        public boolean isRetro() {
            return isRetro;
        }

        public String getSign() {
            return sign;
        }

        public String getSignLord() {
            return signLord;
        }

        public String getNakshatra() {
            return nakshatra;
        }

        public String getNakshatraLord() {
            return nakshatraLord;
        }

        public int getNakshatraPada() {
            return nakshatraPada;
        }

        public int getHouse() {
            return house;
        }
    }

    public static class House {
        private int house;
        private String sign;
        private double degree;

        public House() {
        }

        public House(int house, String sign, double degree) {
            this.house = house;
            this.sign = sign;
            this.degree = degree;
        }

        public int getHouse() {
            return house;
        }

        public String getSign() {
            return sign;
        }

        public double getDegree() {
            return degree;
        }
    }
}
