package ou.capstone.geoconvert;

import java.util.Locale;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ou.capstone.geoconvert.coordinate.Coordinate;
import ou.capstone.geoconvert.exceptions.ConversionException;

/**
 * Command-line driver for coordinate conversion.
 *
 * Reads a latitude and longitude and prints them as:
 * - degrees, minutes and seconds
 * - degrees and decimal minutes
 * - UTM zone, band, easting and northing
 * either as plain text or as JSON.
 */
public final class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    private static ExitHandler exitHandler = new ExitHandler();

    /** Output selected with --format. */
    enum OutputFormat {
        DMS, DM, UTM, ALL;

        static OutputFormat parse(final String raw) {
            try {
                return OutputFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (final IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown format '" + raw + "', expected dms, dm, utm or all", e);
            }
        }
    }

    public static void setExitHandler( final ExitHandler exitHandler )
    {
        App.exitHandler = exitHandler;
    }

    private App() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws ParseException {
        // Latitude and longitude are checked by hand below so that --help
        // works on its own.
        final Option latitudeOption = Option.builder("y")
                .longOpt("latitude").hasArg()
                .desc("Latitude in decimal degrees (-90 to 90)").get();
        final Option longitudeOption = Option.builder("x")
                .longOpt("longitude").hasArg()
                .desc("Longitude in decimal degrees (-180 to 180)").get();
        final Option formatOption = Option.builder("f")
                .longOpt("format").hasArg()
                .desc("Output: 'dms', 'dm', 'utm' or 'all' (default: all)").get();
        final Option templateOption = Option.builder("t")
                .longOpt("template").hasArg()
                .desc("Template for dms/dm output, e.g. '%D°%M′%S″%L %d°%m′%s″%l'").get();
        final Option jsonOption = Option.builder("j")
                .longOpt("json")
                .desc("Print the result as JSON").get();
        final Option helpOption = Option.builder("h").longOpt("help")
                .desc("Display help").get();

        final Options options = new Options();
        options.addOption( latitudeOption );
        options.addOption( longitudeOption );
        options.addOption( formatOption );
        options.addOption( templateOption );
        options.addOption( jsonOption );
        options.addOption( helpOption );

        final CommandLineParser cliParser = new DefaultParser();
        final CommandLine line;
        try {
            line = cliParser.parse(options, args);
        } catch (final ParseException e) {
            logger.error("Parsing args failed for reason: {}",
                    e.getMessage());
            throw e;
        }

        if (line.hasOption(helpOption) || line.getOptions().length == 0) {
            HelpFormatter helpFormatter = HelpFormatter.builder().get();
            helpFormatter.printHelp("geoconvert",
                    "Convert decimal degrees to DMS, DM and UTM", options,
                    "Templates: %P/%p sign, %L/%l hemisphere, %D/%d degrees, %M/%m minutes, "
                            + "%S/%s seconds, %N/%n decimal minutes (upper case latitude, lower case longitude)",
                    true);
            exitHandler.exit(0);
            return;
        }

        final boolean latitudeProvided = line.hasOption(latitudeOption);
        final boolean longitudeProvided = line.hasOption(longitudeOption);

        if (!latitudeProvided || !longitudeProvided) {
            throw new ParseException("Invalid options: " + (latitudeProvided ?
                    "Longitude" :
                    "Latitude") + " is required");
        }

        try {
            final double latitude = parseDegrees(line.getOptionValue(latitudeOption), "latitude");
            final double longitude = parseDegrees(line.getOptionValue(longitudeOption), "longitude");
            final OutputFormat format = line.hasOption(formatOption)
                    ? OutputFormat.parse(line.getOptionValue(formatOption))
                    : OutputFormat.ALL;
            final String template = line.getOptionValue(templateOption);

            if (template != null && (format == OutputFormat.UTM || format == OutputFormat.ALL)) {
                logger.warn("--template only applies to dms or dm output and is ignored for {}", format);
            }

            final Coordinate coordinate = new Coordinate(latitude, longitude);
            logger.info("Converting {} to {}", coordinate, format);

            final Converter converter = new Converter(coordinate);
            if (line.hasOption(jsonOption)) {
                System.out.println(toJson(converter, format, template));
            } else {
                printText(converter, format, template);
            }
            logger.info("Conversion completed successfully");

        } catch (final ConversionException e) {
            logger.error("Conversion failed: {}", e.getMessage());
            System.err.println("\nConversion Error: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            System.err.println("\nError: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final Exception e) {
            logger.error("Unexpected error during execution", e);
            System.err.println("\nUnexpected Error: " + e.getMessage());
            exitHandler.exit(1);
        }
    }

    private static double parseDegrees(final String raw, final String name) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": '" + raw + "' is not a number", e);
        }
    }

    private static void printText(final Converter converter,
                                  final OutputFormat format,
                                  final String template) throws ConversionException {
        switch (format) {
            case DMS:
                System.out.println(template == null ? converter.toDMS() : converter.toDMS(template));
                break;
            case DM:
                System.out.println(template == null ? converter.toDM() : converter.toDM(template));
                break;
            case UTM:
                System.out.println(converter.toUTM());
                break;
            default:
                System.out.println("DMS: " + converter.toDMS());
                System.out.println("DM:  " + converter.toDM());
                System.out.println("UTM: " + converter.toUTM());
                break;
        }
    }

    /**
     * Builds the JSON document for the selected output.
     *
     * @param converter converter bound to the parsed coordinate
     * @param format which representations to include
     * @param template optional dms/dm template
     * @return pretty-printed JSON
     */
    static String toJson(final Converter converter,
                         final OutputFormat format,
                         final String template) throws ConversionException, JsonProcessingException {
        final ObjectNode root = mapper.createObjectNode();
        root.put("latitude", converter.getCoordinate().getLatitude());
        root.put("longitude", converter.getCoordinate().getLongitude());

        if (format == OutputFormat.DMS) {
            root.put("dms", template == null ? converter.toDMS() : converter.toDMS(template));
        } else if (format == OutputFormat.DM) {
            root.put("dm", template == null ? converter.toDM() : converter.toDM(template));
        } else if (format == OutputFormat.UTM) {
            root.set("utm", mapper.valueToTree(converter.project()));
        } else {
            root.put("dms", converter.toDMS());
            root.put("dm", converter.toDM());
            root.set("utm", mapper.valueToTree(converter.project()));
        }
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    public static class ExitHandler
    {
        public void exit( final int code )
        {
            System.exit( code );
        }
    }
}
