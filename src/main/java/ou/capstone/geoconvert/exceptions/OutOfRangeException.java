package ou.capstone.geoconvert.exceptions;

/**
 * Thrown when a coordinate lies where the projection is undefined,
 * such as the poles for UTM.
 */
public class OutOfRangeException extends ConversionException
{
    private final double value;

    public OutOfRangeException( final String msg, final double value )
    {
        super( msg );
        this.value = value;
    }

    /** @return the offending input, in degrees */
    public double getValue()
    {
        return value;
    }
}
