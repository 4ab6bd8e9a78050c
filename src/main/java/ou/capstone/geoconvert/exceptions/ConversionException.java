package ou.capstone.geoconvert.exceptions;

public class ConversionException extends Exception
{
    public ConversionException( final String msg )
    {
        super( msg );
    }
}
