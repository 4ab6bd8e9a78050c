package ou.capstone.geoconvert.utm;

/**
 * Reference ellipsoid given by its semi-major and semi-minor axes, in meters.
 */
public record Ellipsoid(double semiMajorAxis, double semiMinorAxis) {

    public static final Ellipsoid WGS84 = new Ellipsoid(6378137.0, 6356752.314245);

    public Ellipsoid {
        if (!(semiMinorAxis > 0.0) || !Double.isFinite(semiMajorAxis)) {
            throw new IllegalArgumentException("Ellipsoid axes must be positive and finite");
        }
        if (semiMajorAxis < semiMinorAxis) {
            throw new IllegalArgumentException("Semi-major axis (" + semiMajorAxis
                    + ") must not be smaller than semi-minor axis (" + semiMinorAxis + ")");
        }
    }

    /** Second eccentricity squared: (a² - b²) / b². */
    public double secondEccentricitySquared() {
        return (Math.pow(semiMajorAxis, 2.0) - Math.pow(semiMinorAxis, 2.0)) / Math.pow(semiMinorAxis, 2.0);
    }

    /** Third flattening: (a - b) / (a + b). */
    public double thirdFlattening() {
        return (semiMajorAxis - semiMinorAxis) / (semiMajorAxis + semiMinorAxis);
    }
}
