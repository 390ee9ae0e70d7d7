package de.julielab.jules.ae.placemapping.knowledge;

public class GazetteerEntry {
    private final String name;
    private final double latitude;
    private final double longitude;
    private final String region;

    public GazetteerEntry(String name, double latitude, double longitude, String region) {
        this.name = name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.region = region;
    }

    public String getName() {
        return name;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public String getRegion() {
        return region;
    }

    @Override
    public String toString() {
        return "GazetteerEntry [name=" + name + ", latitude=" + latitude + ", longitude=" + longitude + ", region=" + region + "]";
    }
}
