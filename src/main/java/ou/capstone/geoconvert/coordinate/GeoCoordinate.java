package ou.capstone.geoconvert.coordinate;

/**
 * Read-only view of a point in decimal degrees.
 */
public interface GeoCoordinate {

    /** @return latitude in degrees, positive north */
    double getLatitude();

    /** @return longitude in degrees, positive east */
    double getLongitude();
}
