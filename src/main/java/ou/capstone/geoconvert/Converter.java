package ou.capstone.geoconvert;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geoconvert.coordinate.Coordinate;
import ou.capstone.geoconvert.coordinate.GeoCoordinate;
import ou.capstone.geoconvert.exceptions.OutOfRangeException;
import ou.capstone.geoconvert.format.CoordinateDecomposer;
import ou.capstone.geoconvert.format.DecomposedAngle;
import ou.capstone.geoconvert.format.FormatRenderer;
import ou.capstone.geoconvert.utm.UtmCoordinate;
import ou.capstone.geoconvert.utm.UtmProjector;

/**
 * Converts one coordinate to degrees-minutes-seconds, decimal minutes or UTM.
 *
 * Every call recomputes its result; instances hold no mutable state and can be shared.
 */
public final class Converter {
    private static final Logger logger = LoggerFactory.getLogger(Converter.class);

    private final GeoCoordinate coordinate;
    private final ConvertConfig config;
    private final CoordinateDecomposer decomposer;
    private final FormatRenderer renderer;
    private final UtmProjector projector;

    public Converter(final GeoCoordinate coordinate) {
        this(coordinate, ConvertConfig.defaults());
    }

    /**
     * @param coordinate point to convert; copied into a range-checked {@link Coordinate}
     * @param config     templates, rounding and UTM constants
     * @throws IllegalArgumentException if the coordinate is out of range
     */
    public Converter(final GeoCoordinate coordinate, final ConvertConfig config) {
        this.coordinate = Coordinate.of(coordinate);
        this.config = Objects.requireNonNull(config, "config is required");
        this.decomposer = new CoordinateDecomposer(config.decimalMinutesScale(), config.decimalMinutesRounding());
        this.renderer = new FormatRenderer();
        this.projector = new UtmProjector(config.utm());
    }

    /**
     * Formats the coordinate with the configured DMS template.
     */
    public String toDegreesMinutesSeconds() {
        return toDegreesMinutesSeconds(config.dmsFormat());
    }

    /**
     * Formats the coordinate as degrees, minutes and seconds.
     *
     * @param format template using the DMS tokens, e.g. {@code %D°%M′%S″%L}
     * @return the formatted coordinate
     */
    public String toDegreesMinutesSeconds(final String format) {
        logger.debug("Formatting {} as DMS with '{}'", coordinate, format);
        final DecomposedAngle latitude = decomposer.decompose(coordinate.getLatitude());
        final DecomposedAngle longitude = decomposer.decompose(coordinate.getLongitude());
        return renderer.render(format, latitude, longitude, config.dmsPlaceholders());
    }

    /** Alias of {@link #toDegreesMinutesSeconds()}. */
    public String toDMS() {
        return toDegreesMinutesSeconds();
    }

    /** Alias of {@link #toDegreesMinutesSeconds(String)}. */
    public String toDMS(final String format) {
        return toDegreesMinutesSeconds(format);
    }

    /**
     * Formats the coordinate with the configured DM template.
     */
    public String toDecimalMinutes() {
        return toDecimalMinutes(config.dmFormat());
    }

    /**
     * Formats the coordinate as degrees and decimal minutes.
     *
     * @param format template using the DM tokens, e.g. {@code %L %D°%N′}
     * @return the formatted coordinate
     */
    public String toDecimalMinutes(final String format) {
        logger.debug("Formatting {} as DM with '{}'", coordinate, format);
        final DecomposedAngle latitude = decomposer.decompose(coordinate.getLatitude());
        final DecomposedAngle longitude = decomposer.decompose(coordinate.getLongitude());
        return renderer.render(format, latitude, longitude, config.dmPlaceholders());
    }

    /** Alias of {@link #toDecimalMinutes()}. */
    public String toDM() {
        return toDecimalMinutes();
    }

    /** Alias of {@link #toDecimalMinutes(String)}. */
    public String toDM(final String format) {
        return toDecimalMinutes(format);
    }

    /**
     * @return the UTM position as {@code "<zone><band> <easting> <northing>"}
     * @throws OutOfRangeException if the coordinate cannot be projected
     */
    public String toUniversalTransverseMercator() throws OutOfRangeException {
        return project().toString();
    }

    /** Alias of {@link #toUniversalTransverseMercator()}. */
    public String toUTM() throws OutOfRangeException {
        return toUniversalTransverseMercator();
    }

    /**
     * @return the structured UTM position
     * @throws OutOfRangeException if the coordinate cannot be projected
     */
    public UtmCoordinate project() throws OutOfRangeException {
        return projector.project(coordinate);
    }

    public GeoCoordinate getCoordinate() {
        return coordinate;
    }

    public ConvertConfig getConfig() {
        return config;
    }
}
