package ou.capstone.geoconvert.format;

/**
 * An absolute angle split into display parts, with its sign kept aside.
 * Seconds are rounded and never carried into minutes, so 60 is a possible value.
 *
 * @param positive       true when the original value was {@code >= 0}
 * @param degrees        whole degrees of the absolute value
 * @param minutes        whole minutes left over after the degrees
 * @param seconds        remaining seconds rounded to the nearest integer
 * @param decimalMinutes minutes with their fraction, already rounded for display
 */
public record DecomposedAngle(boolean positive, int degrees, int minutes, long seconds, String decimalMinutes) {

    /**
     * Rebuilds the signed decimal-degree value from degrees, minutes and seconds.
     */
    public double toDecimalDegrees() {
        final double abs = degrees + minutes / 60.0 + seconds / 3600.0;
        return positive ? abs : -abs;
    }
}
