package ou.capstone.geoconvert;

import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import ou.capstone.geoconvert.format.CoordinateDecomposer;
import ou.capstone.geoconvert.format.FieldSelector;
import ou.capstone.geoconvert.format.Placeholders;
import ou.capstone.geoconvert.utm.UtmConfig;

/**
 * Configuration for coordinate conversion.
 * Holds the default templates, token mappings, decimal-minutes rounding and UTM constants.
 */
public record ConvertConfig(
    /**
     * Template used by DMS output when the caller passes none.
     */
    String dmsFormat,

    /**
     * Template used by DM output when the caller passes none.
     */
    String dmFormat,

    /**
     * Tokens understood in DMS templates.
     */
    Map<String, FieldSelector> dmsPlaceholders,

    /**
     * Tokens understood in DM templates.
     */
    Map<String, FieldSelector> dmPlaceholders,

    /**
     * Digits kept after the decimal point of decimal minutes.
     */
    int decimalMinutesScale,

    /**
     * Rounding applied to decimal minutes.
     */
    RoundingMode decimalMinutesRounding,

    /**
     * Ellipsoid, scale factor and band letters for UTM.
     */
    UtmConfig utm
) {
    public ConvertConfig {
        Objects.requireNonNull(dmsFormat, "dmsFormat is required");
        Objects.requireNonNull(dmFormat, "dmFormat is required");
        Objects.requireNonNull(decimalMinutesRounding, "decimalMinutesRounding is required");
        Objects.requireNonNull(utm, "utm is required");
        if (decimalMinutesScale < 0) {
            throw new IllegalArgumentException("Decimal minutes scale must not be negative, got: " + decimalMinutesScale);
        }
        if (decimalMinutesRounding == RoundingMode.UNNECESSARY) {
            throw new IllegalArgumentException("Decimal minutes need a rounding mode that can round");
        }
        dmsPlaceholders = copyOf(dmsPlaceholders, "dmsPlaceholders");
        dmPlaceholders = copyOf(dmPlaceholders, "dmPlaceholders");
    }

    /**
     * Creates the default configuration: the standard templates and tokens, decimal minutes
     * rounded half up to 5 digits, and WGS84 UTM.
     */
    public static ConvertConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return a builder pre-filled with this configuration */
    public Builder toBuilder() {
        return new Builder()
                .dmsFormat(dmsFormat)
                .dmFormat(dmFormat)
                .dmsPlaceholders(dmsPlaceholders)
                .dmPlaceholders(dmPlaceholders)
                .decimalMinutesScale(decimalMinutesScale)
                .decimalMinutesRounding(decimalMinutesRounding)
                .utm(utm);
    }

    // Keeps the caller's iteration order, which decides overlapping tokens
    private static Map<String, FieldSelector> copyOf(final Map<String, FieldSelector> placeholders,
                                                     final String name) {
        Objects.requireNonNull(placeholders, name + " is required");
        for (final Map.Entry<String, FieldSelector> entry : placeholders.entrySet()) {
            Objects.requireNonNull(entry.getKey(), name + " contains a null token");
            Objects.requireNonNull(entry.getValue(), name + " has no selector for token '" + entry.getKey() + "'");
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(placeholders));
    }

    /**
     * Fluent builder; every value starts at its default.
     */
    public static class Builder {
        private String dmsFormat = Placeholders.DEFAULT_DMS_FORMAT;
        private String dmFormat = Placeholders.DEFAULT_DM_FORMAT;
        private Map<String, FieldSelector> dmsPlaceholders = Placeholders.DEGREES_MINUTES_SECONDS;
        private Map<String, FieldSelector> dmPlaceholders = Placeholders.DECIMAL_MINUTES;
        private int decimalMinutesScale = CoordinateDecomposer.DEFAULT_DECIMAL_MINUTES_SCALE;
        private RoundingMode decimalMinutesRounding = CoordinateDecomposer.DEFAULT_DECIMAL_MINUTES_ROUNDING;
        private UtmConfig utm = UtmConfig.defaults();

        public Builder dmsFormat(String dmsFormat) {
            this.dmsFormat = dmsFormat;
            return this;
        }

        public Builder dmFormat(String dmFormat) {
            this.dmFormat = dmFormat;
            return this;
        }

        public Builder dmsPlaceholders(Map<String, FieldSelector> dmsPlaceholders) {
            this.dmsPlaceholders = dmsPlaceholders;
            return this;
        }

        public Builder dmPlaceholders(Map<String, FieldSelector> dmPlaceholders) {
            this.dmPlaceholders = dmPlaceholders;
            return this;
        }

        public Builder decimalMinutesScale(int decimalMinutesScale) {
            this.decimalMinutesScale = decimalMinutesScale;
            return this;
        }

        public Builder decimalMinutesRounding(RoundingMode decimalMinutesRounding) {
            this.decimalMinutesRounding = decimalMinutesRounding;
            return this;
        }

        public Builder utm(UtmConfig utm) {
            this.utm = utm;
            return this;
        }

        public ConvertConfig build() {
            return new ConvertConfig(dmsFormat, dmFormat, dmsPlaceholders, dmPlaceholders,
                    decimalMinutesScale, decimalMinutesRounding, utm);
        }
    }
}
