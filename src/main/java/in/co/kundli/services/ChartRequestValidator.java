package in.co.kundli.services;

import in.co.kundli.astro.Ayanamsha;
import in.co.kundli.astro.HouseSystem;
import in.co.kundli.astro.ObservationPoint;
import in.co.kundli.pojos.BirthChartRequest;
import in.co.kundli.pojos.BirthMoment;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw request into a {@link BirthMoment}. Out-of-range values are rejected, never clamped.
 */
public class ChartRequestValidator {

    public BirthMoment validate(BirthChartRequest request) throws ChartValidationException {
        if (request == null) {
            throw new ChartValidationException("Request body is required");
        }
        List<String> errors = new ArrayList<>();

        Integer year = requireInt(errors, "year", request.getYear(), ChartServiceConfig.MIN_YEAR, ChartServiceConfig.MAX_YEAR);
        Integer month = requireInt(errors, "month", request.getMonth(), 1, 12);
        Integer date = requireInt(errors, "date", request.getDate(), 1, 31);
        Integer hours = requireInt(errors, "hours", request.getHours(), 0, 23);
        Integer minutes = requireInt(errors, "minutes", request.getMinutes(), 0, 59);
        Integer seconds = request.getSeconds() == null
                ? Integer.valueOf(ChartServiceConfig.DEFAULT_SECONDS)
                : requireInt(errors, "seconds", request.getSeconds(), 0, 59);

        Double latitude = requireDouble(errors, "latitude", request.getLatitude(), -90.0, 90.0);
        if (latitude != null && Math.abs(latitude) == 90.0) {
            errors.add("latitude must not be a pole (±90), the ascendant is undefined there");
            latitude = null;
        }
        Double longitude = requireDouble(errors, "longitude", request.getLongitude(), -180.0, 180.0);
        Double timezone = requireDouble(errors, "timezone", request.getTimezone(),
                ChartServiceConfig.MIN_TIMEZONE, ChartServiceConfig.MAX_TIMEZONE);

        ObservationPoint observationPoint = ChartServiceConfig.DEFAULT_OBSERVATION_POINT;
        if (request.getObservationPoint() != null) {
            try {
                observationPoint = ObservationPoint.fromRequestValue(request.getObservationPoint());
            } catch (IllegalArgumentException e) {
                errors.add("observation_point must be one of topocentric, geocentric");
            }
        }
        Ayanamsha ayanamsha = ChartServiceConfig.DEFAULT_AYANAMSHA;
        if (request.getAyanamsha() != null) {
            try {
                ayanamsha = Ayanamsha.fromRequestValue(request.getAyanamsha());
            } catch (IllegalArgumentException e) {
                errors.add("ayanamsha must be one of lahiri, raman, krishnamurti, thirukanitham");
            }
        }
        HouseSystem houseSystem = ChartServiceConfig.DEFAULT_HOUSE_SYSTEM;
        if (request.getHouseSystem() != null) {
            try {
                houseSystem = HouseSystem.fromRequestValue(request.getHouseSystem());
            } catch (IllegalArgumentException e) {
                errors.add("house_system must be one of whole_sign, placidus");
            }
        }

        LocalDateTime localDateTime = null;
        if (year != null && month != null && date != null && hours != null && minutes != null && seconds != null) {
            try {
                localDateTime = LocalDateTime.of(year, month, date, hours, minutes, seconds);
            } catch (DateTimeException e) {
                errors.add("date " + year + "-" + month + "-" + date + " does not exist");
            }
        }

        if (!errors.isEmpty()) {
            throw new ChartValidationException(errors);
        }
        return new BirthMoment(localDateTime, timezone, latitude, longitude, observationPoint, ayanamsha, houseSystem);
    }

    private static Integer requireInt(List<String> errors, String field, Integer value, int min, int max) {
        if (value == null) {
            errors.add(field + " is required");
            return null;
        }
        if (value < min || value > max) {
            errors.add(field + " must be between " + min + " and " + max + ", got " + value);
            return null;
        }
        return value;
    }

    private static Double requireDouble(List<String> errors, String field, Double value, double min, double max) {
        if (value == null) {
            errors.add(field + " is required");
            return null;
        }
        if (value.isNaN() || value.isInfinite() || value < min || value > max) {
            errors.add(field + " must be between " + min + " and " + max + ", got " + value);
            return null;
        }
        return value;
    }
}
