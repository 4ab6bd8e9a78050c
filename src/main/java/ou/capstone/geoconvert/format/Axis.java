package ou.capstone.geoconvert.format;

/**
 * Which half of a coordinate an angle belongs to, with its hemisphere letters.
 */
public enum Axis {
    LATITUDE('N', 'S'),
    LONGITUDE('E', 'W');

    private final char positiveDirection;
    private final char negativeDirection;

    Axis(final char positiveDirection, final char negativeDirection) {
        this.positiveDirection = positiveDirection;
        this.negativeDirection = negativeDirection;
    }

    /** @return the hemisphere letter for an angle of the given sign */
    public char direction(final boolean positive) {
        return positive ? positiveDirection : negativeDirection;
    }
}
