package ou.capstone.geoconvert.utm;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geoconvert.coordinate.GeoCoordinate;
import ou.capstone.geoconvert.exceptions.OutOfRangeException;

/**
 * UtmProjector
 *
 * - Projects latitude/longitude onto the Transverse Mercator plane of its UTM zone
 * - Uses the series expansion in the longitude offset up to the 8th power
 * - Looks up the latitude band letter
 *
 */
public final class UtmProjector {
    private static final Logger logger = LoggerFactory.getLogger(UtmProjector.class);

    private static final double FALSE_EASTING = 500000.0;
    private static final double FALSE_NORTHING = 10000000.0;
    private static final int ZONE_COUNT = 60;
    private static final double MIN_BAND_LATITUDE = -80.0;
    private static final double MAX_BAND_LATITUDE = 84.0;

    private final UtmConfig config;

    // Depend only on the ellipsoid
    private final double ep2;
    private final double alpha;
    private final double beta;
    private final double gamma;
    private final double delta;
    private final double epsilon;

    public UtmProjector() {
        this(UtmConfig.defaults());
    }

    public UtmProjector(final UtmConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");

        final double a = config.ellipsoid().semiMajorAxis();
        final double b = config.ellipsoid().semiMinorAxis();
        final double n = config.ellipsoid().thirdFlattening();

        this.ep2 = config.ellipsoid().secondEccentricitySquared();
        this.alpha = ((a + b) / 2.0) * (1.0 + (Math.pow(n, 2.0) / 4.0) + (Math.pow(n, 4.0) / 64.0));
        this.beta = (-3.0 * n / 2.0) + (9.0 * Math.pow(n, 3.0) / 16.0) + (-3.0 * Math.pow(n, 5.0) / 32.0);
        this.gamma = (15.0 * Math.pow(n, 2.0) / 16.0) + (-15.0 * Math.pow(n, 4.0) / 32.0);
        this.delta = (-35.0 * Math.pow(n, 3.0) / 48.0) + (105.0 * Math.pow(n, 5.0) / 256.0);
        this.epsilon = (315.0 * Math.pow(n, 4.0) / 512.0);
    }

    /**
     * Projects a coordinate to UTM.
     *
     * @param coordinate point in decimal degrees
     * @return zone, band, easting and northing
     * @throws OutOfRangeException at the poles, or if the series does not produce finite values
     */
    public UtmCoordinate project(final GeoCoordinate coordinate) throws OutOfRangeException {
        Objects.requireNonNull(coordinate, "coordinate is required");
        final double latitude = coordinate.getLatitude();
        final double longitude = coordinate.getLongitude();

        if (!(Math.abs(latitude) < 90.0)) {
            logger.error("Cannot project latitude {}: UTM is undefined at the poles", latitude);
            throw new OutOfRangeException("Latitude " + latitude + " cannot be projected to UTM", latitude);
        }

        final double phi = Math.toRadians(latitude);
        final double lambda = Math.toRadians(longitude);

        final int zone = zone(longitude);
        // Central meridian of the zone
        final double lambda0 = Math.toRadians(-183.0 + (zone * 6.0));

        final double a = config.ellipsoid().semiMajorAxis();
        final double b = config.ellipsoid().semiMinorAxis();
        final double cosPhi = Math.cos(phi);

        final double nu2 = ep2 * Math.pow(cosPhi, 2.0);
        final double nN = Math.pow(a, 2.0) / (b * Math.sqrt(1 + nu2));
        final double t = Math.tan(phi);
        final double t2 = t * t;
        final double l = lambda - lambda0;

        final double l3coef = 1.0 - t2 + nu2;
        final double l4coef = 5.0 - t2 + 9 * nu2 + 4.0 * (nu2 * nu2);
        final double l5coef = 5.0 - 18.0 * t2 + (t2 * t2) + 14.0 * nu2 - 58.0 * t2 * nu2;
        final double l6coef = 61.0 - 58.0 * t2 + (t2 * t2) + 270.0 * nu2 - 330.0 * t2 * nu2;
        final double l7coef = 61.0 - 479.0 * t2 + 179.0 * (t2 * t2) - (t2 * t2 * t2);
        final double l8coef = 1385.0 - 3111.0 * t2 + 543.0 * (t2 * t2) - (t2 * t2 * t2);

        double easting = nN * cosPhi * l
                + (nN / 6.0 * Math.pow(cosPhi, 3.0) * l3coef * Math.pow(l, 3.0))
                + (nN / 120.0 * Math.pow(cosPhi, 5.0) * l5coef * Math.pow(l, 5.0))
                + (nN / 5040.0 * Math.pow(cosPhi, 7.0) * l7coef * Math.pow(l, 7.0));

        double northing = alpha
                * (phi + (beta * Math.sin(2.0 * phi))
                + (gamma * Math.sin(4.0 * phi))
                + (delta * Math.sin(6.0 * phi))
                + (epsilon * Math.sin(8.0 * phi)))
                + (t / 2.0 * nN * Math.pow(cosPhi, 2.0) * Math.pow(l, 2.0))
                + (t / 24.0 * nN * Math.pow(cosPhi, 4.0) * l4coef * Math.pow(l, 4.0))
                + (t / 720.0 * nN * Math.pow(cosPhi, 6.0) * l6coef * Math.pow(l, 6.0))
                + (t / 40320.0 * nN * Math.pow(cosPhi, 8.0) * l8coef * Math.pow(l, 8.0));

        easting = easting * config.scaleFactor() + FALSE_EASTING;
        northing = northing * config.scaleFactor();
        if (northing < 0.0) {
            northing += FALSE_NORTHING;
        }

        if (!Double.isFinite(easting) || !Double.isFinite(northing)) {
            logger.error("Projection of ({}, {}) diverged: easting={}, northing={}",
                    latitude, longitude, easting, northing);
            throw new OutOfRangeException("UTM projection diverged for latitude " + latitude, latitude);
        }

        final UtmCoordinate result = new UtmCoordinate(zone, latitudeBand(latitude), easting, northing);
        logger.debug("Projected ({}, {}) to {}", latitude, longitude, result);
        return result;
    }

    /**
     * Longitudinal zone, 1 to 60. Longitude 180 is kept in zone 60.
     */
    public static int zone(final double longitude) {
        final int zone = (int) Math.floor((longitude + 180.0) / 6.0) + 1;
        return Math.max(1, Math.min(ZONE_COUNT, zone));
    }

    /**
     * Band letter for {@code latitude}. Latitudes outside the banded range take the
     * letter of the nearest band.
     *
     * @throws IllegalArgumentException if {@code latitude} is NaN
     */
    public char latitudeBand(final double latitude) {
        if (Double.isNaN(latitude)) {
            throw new IllegalArgumentException("Latitude band is undefined for NaN");
        }
        final String bands = config.latitudeBands();
        final int index = (int) Math.floor((latitude + 80.0) / 8.0);
        final int clamped = Math.max(0, Math.min(bands.length() - 1, index));
        // X stretches up to 84°N, so only warn beyond that
        if (latitude < MIN_BAND_LATITUDE || latitude > MAX_BAND_LATITUDE) {
            logger.warn("Latitude {} is outside the UTM bands, using band {}", latitude, bands.charAt(clamped));
        }
        return bands.charAt(clamped);
    }

    public UtmConfig getConfig() {
        return config;
    }
}
