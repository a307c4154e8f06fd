package in.co.kundli.pojos;

import in.co.kundli.astro.Ayanamsha;
import in.co.kundli.astro.HouseSystem;
import in.co.kundli.astro.ObservationPoint;
import in.co.kundli.astro.Observer;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * A validated birth request: civil time with its UTC offset, the place, and the calculation options.
 * Built only by the request validator, so every value is in range.
 */
public class BirthMoment {
    private final LocalDateTime localDateTime;
    private final double utcOffsetHours;
    private final double latitude;
    private final double longitude;
    private final ObservationPoint observationPoint;
    private final Ayanamsha ayanamsha;
    private final HouseSystem houseSystem;

    public BirthMoment(LocalDateTime localDateTime, double utcOffsetHours, double latitude, double longitude,
                       ObservationPoint observationPoint, Ayanamsha ayanamsha, HouseSystem houseSystem) {
        this.localDateTime = localDateTime;
        this.utcOffsetHours = utcOffsetHours;
        this.latitude = latitude;
        this.longitude = longitude;
        this.observationPoint = observationPoint;
        this.ayanamsha = ayanamsha;
        this.houseSystem = houseSystem;
    }

    /**
     * Absolute instant, with local = UTC + offset.
     */
    public Instant toUtc() {
        return localDateTime.toInstant(getZoneOffset());
    }

    public ZoneOffset getZoneOffset() {
        return ZoneOffset.ofTotalSeconds((int) Math.round(utcOffsetHours * 3600.0));
    }

    public Observer toObserver() {
        return new Observer(latitude, longitude, observationPoint);
    }

    public LocalDateTime getLocalDateTime() {
        return localDateTime;
    }

    public double getUtcOffsetHours() {
        return utcOffsetHours;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public ObservationPoint getObservationPoint() {
        return observationPoint;
    }

    public Ayanamsha getAyanamsha() {
        return ayanamsha;
    }

    public HouseSystem getHouseSystem() {
        return houseSystem;
    }
}
