package ou.capstone.geoconvert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class AppArgParsingTest
{
    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private App.ExitHandler exitHandler;

    @BeforeEach
    public void setUp()
    {
        exitHandler = mock( App.ExitHandler.class );
        App.setExitHandler( exitHandler );
        System.setOut( new PrintStream( out, true, StandardCharsets.UTF_8 ) );
        System.setErr( new PrintStream( err, true, StandardCharsets.UTF_8 ) );
    }

    @AfterEach
    public void tearDown()
    {
        System.setOut( originalOut );
        System.setErr( originalErr );
        App.setExitHandler( new App.ExitHandler() );
    }

    private String stdout()
    {
        return out.toString( StandardCharsets.UTF_8 );
    }

    @Test
    public void testMissingLongitudeThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            // only latitude is provided, longitude is missing
            final String[] params = { "--latitude", "40.5" };
            App.main( params );
        } );
    }

    @Test
    public void testMissingLatitudeShortThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "-x", "-79.9" };
            App.main( params );
        } );
    }

    @Test
    public void testMissingLatitudeArgThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "--latitude" };
            App.main( params );
        } );
    }

    @Test
    public void testUnsupportedOptions()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "--clowns", "all-of-them" };
            App.main( params );
        } );
    }

    @Test
    public void testNoArgs() throws Exception
    {
        final String[] params = {};
        App.main( params );
        // Should just print help and exit with return code of zero
        verify( exitHandler ).exit( 0 );
    }

    @Test
    public void testHelp() throws Exception
    {
        final String[] params = { "--help" };
        App.main( params );
        verify( exitHandler ).exit( 0 );
    }

    @Test
    public void testDmsOutput() throws Exception
    {
        final String[] params = { "-y", "40.446195", "-x", "-79.948862", "-f", "dms" };
        App.main( params );
        verify( exitHandler, never() ).exit( anyInt() );
        assertEquals( "40°26′46″N, 79°56′56″W", stdout().trim() );
    }

    @Test
    public void testDmOutputWithTemplate() throws Exception
    {
        final String[] params = { "--latitude", "-33.85", "--longitude", "151.2",
                "--format", "DM", "--template", "%P%D %N, %p%d %n" };
        App.main( params );
        verify( exitHandler, never() ).exit( anyInt() );
        assertEquals( "-33 51, 151 12", stdout().trim() );
    }

    @Test
    public void testUtmOutput() throws Exception
    {
        final String[] params = { "-y", "48.8577", "-x", "2.2942", "-f", "utm" };
        App.main( params );
        assertEquals( "31U 448229 5411877", stdout().trim() );
    }

    @Test
    public void testAllOutput() throws Exception
    {
        final String[] params = { "-y", "40.446195", "-x", "-79.948862" };
        App.main( params );
        final String text = stdout();
        assertTrue( text.contains( "DMS: 40°26′46″N, 79°56′56″W" ) );
        assertTrue( text.contains( "DM:  N 40°26.7717′, W 79°56.93172′" ) );
        assertTrue( text.contains( "UTM: 17T 589138 4477812" ) );
    }

    @Test
    public void testJsonOutput() throws Exception
    {
        final String[] params = { "-y", "40.446195", "-x", "-79.948862", "--json" };
        App.main( params );

        final JsonNode json = new ObjectMapper().readTree( stdout() );
        assertEquals( 40.446195, json.get( "latitude" ).asDouble(), 1e-9 );
        assertEquals( "40°26′46″N, 79°56′56″W", json.get( "dms" ).asText() );
        assertEquals( "N 40°26.7717′, W 79°56.93172′", json.get( "dm" ).asText() );
        assertEquals( 17, json.get( "utm" ).get( "zone" ).asInt() );
        assertEquals( "T", json.get( "utm" ).get( "latitudeBand" ).asText() );
        assertEquals( 589138.8979, json.get( "utm" ).get( "easting" ).asDouble(), 0.001 );
        assertEquals( "17T 589138 4477812", json.get( "utm" ).get( "text" ).asText() );
    }

    @Test
    public void testJsonUtmOnly() throws Exception
    {
        final String[] params = { "-y", "0", "-x", "3", "-f", "utm", "-j" };
        App.main( params );

        final JsonNode json = new ObjectMapper().readTree( stdout() );
        assertTrue( json.has( "utm" ) );
        assertTrue( !json.has( "dms" ) && !json.has( "dm" ) );
        assertEquals( "31N 500000 0", json.get( "utm" ).get( "text" ).asText() );
    }

    @Test
    public void testInvalidNumberExitsWithError() throws Exception
    {
        final String[] params = { "-y", "north", "-x", "10" };
        App.main( params );
        verify( exitHandler ).exit( 1 );
    }

    @Test
    public void testOutOfRangeLatitudeExitsWithError() throws Exception
    {
        final String[] params = { "-y", "95", "-x", "10" };
        App.main( params );
        verify( exitHandler ).exit( 1 );
    }

    @Test
    public void testUnknownFormatExitsWithError() throws Exception
    {
        final String[] params = { "-y", "10", "-x", "10", "-f", "mgrs" };
        App.main( params );
        verify( exitHandler ).exit( 1 );
    }

    @Test
    public void testPoleUtmExitsWithError() throws Exception
    {
        final String[] params = { "-y", "90", "-x", "0", "-f", "utm" };
        App.main( params );
        verify( exitHandler ).exit( 1 );
    }
}
