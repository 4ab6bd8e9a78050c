package ou.capstone.geoconvert.utm;

import java.util.Objects;

/**
 * Constants driving the UTM projection.
 *
 * @param ellipsoid      Earth model
 * @param scaleFactor    scale on the central meridian (k0)
 * @param latitudeBands  20 band letters from -80° north in 8° steps
 */
public record UtmConfig(Ellipsoid ellipsoid, double scaleFactor, String latitudeBands) {

    public static final double DEFAULT_SCALE_FACTOR = 0.9996;
    public static final String DEFAULT_LATITUDE_BANDS = "CDEFGHJKLMNPQRSTUVWX";
    public static final int BAND_COUNT = 20;

    public UtmConfig {
        Objects.requireNonNull(ellipsoid, "ellipsoid is required");
        Objects.requireNonNull(latitudeBands, "latitudeBands is required");
        if (!(scaleFactor > 0.0) || !Double.isFinite(scaleFactor)) {
            throw new IllegalArgumentException("Scale factor must be positive, got: " + scaleFactor);
        }
        if (latitudeBands.length() != BAND_COUNT) {
            throw new IllegalArgumentException("Expected " + BAND_COUNT + " latitude bands, got "
                    + latitudeBands.length() + ": '" + latitudeBands + "'");
        }
    }

    /**
     * WGS84 with the standard UTM scale factor and band letters.
     */
    public static UtmConfig defaults() {
        return new UtmConfig(Ellipsoid.WGS84, DEFAULT_SCALE_FACTOR, DEFAULT_LATITUDE_BANDS);
    }
}
