package ou.capstone.geoconvert.utm;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A projected UTM position.
 *
 * @param zone          longitudinal zone, 1 to 60
 * @param latitudeBand  band letter
 * @param easting       meters, false easting included
 * @param northing      meters, false northing included south of the equator
 */
@JsonPropertyOrder({"zone", "latitudeBand", "easting", "northing", "text"})
public record UtmCoordinate(int zone, char latitudeBand, double easting, double northing) {

    /** Whole meters east, truncated toward zero. */
    @JsonIgnore
    public long eastingMeters() {
        return (long) easting;
    }

    /** Whole meters north, truncated toward zero. */
    @JsonIgnore
    public long northingMeters() {
        return (long) northing;
    }

    /** Same as {@link #toString()}, exposed for JSON output. */
    @JsonProperty("text")
    public String text() {
        return toString();
    }

    /**
     * @return {@code "<zone><band> <easting> <northing>"}, e.g. {@code 31U 448229 5411877}
     */
    @Override
    public String toString() {
        return String.format(Locale.US, "%d%c %d %d", zone, latitudeBand, eastingMeters(), northingMeters());
    }
}
