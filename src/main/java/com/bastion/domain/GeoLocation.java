package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Geolocation annotation attached to an authentication attempt by the upstream
 * geolocation detector.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeoLocation {

    @JsonProperty("country")
    private String country;

    @JsonProperty("region")
    private String region;

    @JsonProperty("city")
    private String city;

    @JsonProperty("latitude")
    private double latitude;

    @JsonProperty("longitude")
    private double longitude;

    @JsonProperty("timezone")
    private String timezone;

    @JsonProperty("usualLocation")
    private boolean usualLocation;

    public GeoLocation() {
    }

    public GeoLocation(String country, double latitude, double longitude, boolean usualLocation) {
        this.country = country;
        this.latitude = latitude;
        this.longitude = longitude;
        this.usualLocation = usualLocation;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public double getLatitude() {
        return latitude;
    }

    public void setLatitude(double latitude) {
        this.latitude = latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public void setLongitude(double longitude) {
        this.longitude = longitude;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isUsualLocation() {
        return usualLocation;
    }

    public void setUsualLocation(boolean usualLocation) {
        this.usualLocation = usualLocation;
    }
}
