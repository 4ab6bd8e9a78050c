package ou.capstone.geoconvert;

import org.junit.jupiter.api.Test;

import java.math.RoundingMode;

import ou.capstone.geoconvert.coordinate.Coordinate;
import ou.capstone.geoconvert.coordinate.GeoCoordinate;
import ou.capstone.geoconvert.exceptions.OutOfRangeException;
import ou.capstone.geoconvert.utm.UtmCoordinate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Converter
 */
class ConverterTest {

    private final Converter pittsburgh = new Converter(new Coordinate(40.446195, -79.948862));
    private final Converter sydney = new Converter(new Coordinate(-33.85, 151.2));

    @Test
    void testToDegreesMinutesSeconds_DefaultFormat() {
        assertEquals("40°26′46″N, 79°56′56″W", pittsburgh.toDegreesMinutesSeconds());
    }

    @Test
    void testToDegreesMinutesSeconds_CustomFormat() {
        assertEquals("-33:51:0 151:11:60", sydney.toDegreesMinutesSeconds("%P%D:%M:%S %p%d:%m:%s"));
    }

    @Test
    void testToDMS_IsAlias() {
        assertEquals(pittsburgh.toDegreesMinutesSeconds(), pittsburgh.toDMS());
        assertEquals(pittsburgh.toDegreesMinutesSeconds("%D %d"), pittsburgh.toDMS("%D %d"));
    }

    @Test
    void testToDecimalMinutes_DefaultFormat() {
        assertEquals("N 40°26.7717′, W 79°56.93172′", pittsburgh.toDecimalMinutes());
        assertEquals("S 33°51′, E 151°12′", sydney.toDecimalMinutes());
    }

    @Test
    void testToDecimalMinutes_CustomFormat() {
        assertEquals("40 26.7717 -79 56.93172", pittsburgh.toDecimalMinutes("%P%D %N %p%d %n"));
    }

    @Test
    void testToDM_IsAlias() {
        assertEquals(pittsburgh.toDecimalMinutes(), pittsburgh.toDM());
        assertEquals(pittsburgh.toDecimalMinutes("%N"), pittsburgh.toDM("%N"));
    }

    @Test
    void testToUniversalTransverseMercator() throws Exception {
        assertEquals("17T 589138 4477812", pittsburgh.toUniversalTransverseMercator());
        assertEquals("56H 333471 6253018", sydney.toUTM());
    }

    @Test
    void testProject_Structured() throws Exception {
        UtmCoordinate utm = pittsburgh.project();

        assertEquals(17, utm.zone());
        assertEquals('T', utm.latitudeBand());
        assertEquals(589138L, utm.eastingMeters());
        assertEquals(4477812L, utm.northingMeters());
    }

    @Test
    void testToUTM_PoleThrowsException() {
        Converter pole = new Converter(new Coordinate(-90.0, 0.0));

        assertThrows(OutOfRangeException.class, pole::toUTM);
        // DMS still works at the pole
        assertEquals("90°0′0″S, 0°0′0″E", pole.toDMS());
    }

    @Test
    void testForeignCoordinateIsValidated() {
        GeoCoordinate outOfRange = new GeoCoordinate() {
            @Override
            public double getLatitude() {
                return 120.0;
            }

            @Override
            public double getLongitude() {
                return 0.0;
            }
        };

        assertThrows(IllegalArgumentException.class, () -> new Converter(outOfRange));
    }

    @Test
    void testConfiguredTemplatesAndRounding() {
        ConvertConfig config = ConvertConfig.builder()
                .dmsFormat("%L%D %M %S %l%d %m %s")
                .dmFormat("%D %N | %d %n")
                .decimalMinutesScale(2)
                .decimalMinutesRounding(RoundingMode.DOWN)
                .build();
        Converter converter = new Converter(new Coordinate(40.446195, -79.948862), config);

        assertEquals("N40 26 46 W79 56 56", converter.toDMS());
        assertEquals("40 26.77 | 79 56.93", converter.toDM());
    }
}
