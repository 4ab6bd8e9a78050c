package ou.capstone.geoconvert.format;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default template tokens and the token mappings used for DMS and DM output.
 * Upper-case tokens refer to the latitude, lower-case ones to the longitude.
 */
public final class Placeholders {

    public static final String LATITUDE_SIGN = "%P";
    public static final String LATITUDE_DIRECTION = "%L";
    public static final String LATITUDE_DEGREES = "%D";
    public static final String LATITUDE_MINUTES = "%M";
    public static final String LATITUDE_SECONDS = "%S";
    public static final String LATITUDE_DECIMAL_MINUTES = "%N";

    public static final String LONGITUDE_SIGN = "%p";
    public static final String LONGITUDE_DIRECTION = "%l";
    public static final String LONGITUDE_DEGREES = "%d";
    public static final String LONGITUDE_MINUTES = "%m";
    public static final String LONGITUDE_SECONDS = "%s";
    public static final String LONGITUDE_DECIMAL_MINUTES = "%n";

    /** e.g. {@code 40°26′46″N, 79°56′56″W} */
    public static final String DEFAULT_DMS_FORMAT = "%D°%M′%S″%L, %d°%m′%s″%l";

    /** e.g. {@code N 40°26.7717′, W 79°56.93172′} */
    public static final String DEFAULT_DM_FORMAT = "%L %D°%N′, %l %d°%n′";

    /** Tokens understood when rendering degrees, minutes and seconds. */
    public static final Map<String, FieldSelector> DEGREES_MINUTES_SECONDS;

    /** Tokens understood when rendering degrees and decimal minutes. */
    public static final Map<String, FieldSelector> DECIMAL_MINUTES;

    static {
        final Map<String, FieldSelector> dms = new LinkedHashMap<>();
        dms.put(LATITUDE_SIGN, FieldSelector.latitude(AngleField.SIGN));
        dms.put(LATITUDE_DIRECTION, FieldSelector.latitude(AngleField.DIRECTION));
        dms.put(LATITUDE_DEGREES, FieldSelector.latitude(AngleField.DEGREES));
        dms.put(LATITUDE_MINUTES, FieldSelector.latitude(AngleField.MINUTES));
        dms.put(LATITUDE_SECONDS, FieldSelector.latitude(AngleField.SECONDS));
        dms.put(LONGITUDE_SIGN, FieldSelector.longitude(AngleField.SIGN));
        dms.put(LONGITUDE_DIRECTION, FieldSelector.longitude(AngleField.DIRECTION));
        dms.put(LONGITUDE_DEGREES, FieldSelector.longitude(AngleField.DEGREES));
        dms.put(LONGITUDE_MINUTES, FieldSelector.longitude(AngleField.MINUTES));
        dms.put(LONGITUDE_SECONDS, FieldSelector.longitude(AngleField.SECONDS));
        DEGREES_MINUTES_SECONDS = Collections.unmodifiableMap(dms);

        final Map<String, FieldSelector> dm = new LinkedHashMap<>();
        dm.put(LATITUDE_SIGN, FieldSelector.latitude(AngleField.SIGN));
        dm.put(LATITUDE_DIRECTION, FieldSelector.latitude(AngleField.DIRECTION));
        dm.put(LATITUDE_DEGREES, FieldSelector.latitude(AngleField.DEGREES));
        dm.put(LATITUDE_DECIMAL_MINUTES, FieldSelector.latitude(AngleField.DECIMAL_MINUTES));
        dm.put(LONGITUDE_SIGN, FieldSelector.longitude(AngleField.SIGN));
        dm.put(LONGITUDE_DIRECTION, FieldSelector.longitude(AngleField.DIRECTION));
        dm.put(LONGITUDE_DEGREES, FieldSelector.longitude(AngleField.DEGREES));
        dm.put(LONGITUDE_DECIMAL_MINUTES, FieldSelector.longitude(AngleField.DECIMAL_MINUTES));
        DECIMAL_MINUTES = Collections.unmodifiableMap(dm);
    }

    private Placeholders() {
        // Prevent instantiation
    }
}
