package in.co.kundli.services;

import in.co.kundli.astro.Angles;
import in.co.kundli.astro.AscendantCalculator;
import in.co.kundli.astro.AyanamshaCalculator;
import in.co.kundli.astro.AyanamshaResult;
import in.co.kundli.astro.Body;
import in.co.kundli.astro.ChartAngles;
import in.co.kundli.astro.EphemerisHolder;
import in.co.kundli.astro.HouseAssignment;
import in.co.kundli.astro.HouseCusp;
import in.co.kundli.astro.HouseSystem;
import in.co.kundli.astro.LunarNodeCalculator;
import in.co.kundli.astro.PlanetPosition;
import in.co.kundli.astro.PlanetaryPositionCalculator;
import in.co.kundli.astro.TimeConversion;
import in.co.kundli.pojos.BirthChartRequest;
import in.co.kundli.pojos.BirthChartResponse;
import in.co.kundli.pojos.BirthMoment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a complete sidereal birth chart. A chart is either fully computed or not at all.
 */
public class BirthChartService {

    private final EphemerisHolder ephemerisHolder;
    private final ChartRequestValidator validator;

    public BirthChartService() {
        this(EphemerisHolder.getDefault(), new ChartRequestValidator());
    }

    public BirthChartService(EphemerisHolder ephemerisHolder, ChartRequestValidator validator) {
        this.ephemerisHolder = ephemerisHolder;
        this.validator = validator;
    }

    /**
     * Validate the request and compute its chart.
     *
     * @throws ChartValidationException before any calculation, if the request is out of range
     * @throws in.co.kundli.astro.EphemerisUnavailableException if the ephemeris cannot be loaded
     */
    public BirthChartResponse getBirthChart(BirthChartRequest request) throws ChartValidationException {
        return calculate(validator.validate(request));
    }

    public BirthChartResponse calculate(BirthMoment moment) {
        long startTime = LoggingService.logOperationStart("birth_chart", LoggingService.data(
                "houseSystem", moment.getHouseSystem().getRequestValue(),
                "ayanamsha", moment.getAyanamsha().getRequestValue(),
                "observationPoint", moment.getObservationPoint().getRequestValue()));
        try {
            Instant utc = moment.toUtc();
            double julianDate = TimeConversion.toJulianDate(utc);

            AyanamshaResult ayanamsha = AyanamshaCalculator.calculate(moment.getAyanamsha(), julianDate);
            List<String> warnings = new ArrayList<>();
            if (ayanamsha.isFallback()) {
                warnings.add("Ayanamsha '" + ayanamsha.getRequested().getRequestValue()
                        + "' is not supported yet; computed with lahiri");
            }

            PlanetaryPositionCalculator positionCalculator = new PlanetaryPositionCalculator(ephemerisHolder.get());
            List<PlanetPosition> bodies = atReportedPrecision(
                    positionCalculator.calculate(utc, moment.toObserver(), ayanamsha.getValue()));

            ChartAngles angles = atReportedPrecision(
                    AscendantCalculator.calculate(julianDate, moment.getLatitude(), moment.getLongitude(), ayanamsha.getValue()));
            HouseSystem houseSystem = moment.getHouseSystem();
            List<HouseCusp> cusps = houseSystem.cusps(angles);

            List<PlanetPosition> placed = new ArrayList<>(HouseAssignment.assign(bodies, cusps, houseSystem));
            PlanetPosition moon = findBody(bodies, Body.MOON);
            placed.addAll(HouseAssignment.assign(LunarNodeCalculator.fromMoon(moon), cusps, houseSystem));

            BirthChartResponse response = BirthChartResponse.from(moment, ayanamsha, angles, placed, cusps, warnings);
            LoggingService.logOperationEnd("birth_chart", startTime, LoggingService.data(
                    "julianDate", julianDate,
                    "ascendantSign", response.getAscendantSign()));
            return response;
        } catch (RuntimeException e) {
            LoggingService.logOperationFailed("birth_chart", startTime, e);
            throw e;
        }
    }

    /**
     * Longitudes rounded to the output scale before signs and houses are derived from them,
     * so a body reported at 30.0 is never placed in Aries.
     */
    static List<PlanetPosition> atReportedPrecision(List<PlanetPosition> positions) {
        List<PlanetPosition> rounded = new ArrayList<>(positions.size());
        for (PlanetPosition position : positions) {
            rounded.add(PlanetPosition.of(position.getBody(),
                    Angles.roundLongitude(position.getLongitude(), ChartServiceConfig.DEGREE_SCALE),
                    position.getSpeed(), position.isRetrograde()));
        }
        return rounded;
    }

    static ChartAngles atReportedPrecision(ChartAngles angles) {
        return new ChartAngles(
                Angles.roundLongitude(angles.getAscendant(), ChartServiceConfig.DEGREE_SCALE),
                Angles.roundLongitude(angles.getMidheaven(), ChartServiceConfig.DEGREE_SCALE),
                angles.getRamc(),
                angles.getLocalSiderealTime());
    }

    private static PlanetPosition findBody(List<PlanetPosition> positions, Body body) {
        for (PlanetPosition position : positions) {
            if (position.getBody() == body) {
                return position;
            }
        }
        throw new IllegalStateException(body + " missing from calculated positions");
    }
}
