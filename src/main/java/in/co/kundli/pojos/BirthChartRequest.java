package in.co.kundli.pojos;

import com.google.gson.annotations.SerializedName;

/**
 * Body of a birth chart request. Numeric fields are boxed so a missing field stays null until validation.
 */
public class BirthChartRequest {
    private String function; // legacy dispatch, e.g. "get_birth_chart"

    private Integer year;
    private Integer month;
    private Integer date;
    private Integer hours;
    private Integer minutes;
    private Integer seconds;
    private Double latitude;
    private Double longitude;
    private Double timezone; // hours, local = UTC + timezone

    @SerializedName(value = "observation_point", alternate = {"observationPoint"})
    private String observationPoint;
    private String ayanamsha;
    @SerializedName(value = "house_system", alternate = {"houseSystem"})
    private String houseSystem;

    public BirthChartRequest() {
    }

    public String getFunction() {
        return function;
    }

    public void setFunction(String function) {
        this.function = function;
    }

    public Integer getYear() {
        return year;
    }

    public void setYear(Integer year) {
        this.year = year;
    }

    public Integer getMonth() {
        return month;
    }

    public void setMonth(Integer month) {
        this.month = month;
    }

    public Integer getDate() {
        return date;
    }

    public void setDate(Integer date) {
        this.date = date;
    }

    public Integer getHours() {
        return hours;
    }

    public void setHours(Integer hours) {
        this.hours = hours;
    }

    public Integer getMinutes() {
        return minutes;
    }

    public void setMinutes(Integer minutes) {
        this.minutes = minutes;
    }

    public Integer getSeconds() {
        return seconds;
    }

    public void setSeconds(Integer seconds) {
        this.seconds = seconds;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public Double getTimezone() {
        return timezone;
    }

    public void setTimezone(Double timezone) {
        this.timezone = timezone;
    }

    public String getObservationPoint() {
        return observationPoint;
    }

    public void setObservationPoint(String observationPoint) {
        this.observationPoint = observationPoint;
    }

    public String getAyanamsha() {
        return ayanamsha;
    }

    public void setAyanamsha(String ayanamsha) {
        this.ayanamsha = ayanamsha;
    }

    public String getHouseSystem() {
        return houseSystem;
    }

    public void setHouseSystem(String houseSystem) {
        this.houseSystem = houseSystem;
    }
}
