package ou.capstone.geoconvert.coordinate;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable geographic coordinate (latitude/longitude in degrees).
 * Provides basic validation and formatted output.
 */
public final class Coordinate implements GeoCoordinate {

    private final double latDeg;
    private final double lonDeg;

    /**
     * Constructs a Coordinate object with validation.
     *
     * @param latDeg latitude in degrees (-90 to +90)
     * @param lonDeg longitude in degrees (-180 to +180)
     * @throws IllegalArgumentException if latitude or longitude are out of range or NaN
     */
    public Coordinate(final double latDeg, final double lonDeg) {
        if (Double.isNaN(latDeg) || latDeg < -90.0 || latDeg > 90.0) {
            throw new IllegalArgumentException("Latitude must be between -90 and +90 degrees, got: " + latDeg);
        }
        if (Double.isNaN(lonDeg) || lonDeg < -180.0 || lonDeg > 180.0) {
            throw new IllegalArgumentException("Longitude must be between -180 and +180 degrees, got: " + lonDeg);
        }
        this.latDeg = latDeg;
        this.lonDeg = lonDeg;
    }

    /**
     * Copies any other coordinate implementation, validating it on the way in.
     */
    public static Coordinate of(final GeoCoordinate other) {
        Objects.requireNonNull(other, "coordinate is required");
        if (other instanceof Coordinate) {
            return (Coordinate) other;
        }
        return new Coordinate(other.getLatitude(), other.getLongitude());
    }

    @Override
    public double getLatitude() {
        return latDeg;
    }

    @Override
    public double getLongitude() {
        return lonDeg;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate)) return false;
        final Coordinate that = (Coordinate) o;
        return Double.compare(latDeg, that.latDeg) == 0
                && Double.compare(lonDeg, that.lonDeg) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latDeg, lonDeg);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.6f, %.6f)", latDeg, lonDeg);
    }
}
