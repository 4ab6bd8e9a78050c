package ou.capstone.geoconvert.format;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a decimal-degree value into whole degrees, whole minutes, rounded seconds
 * and a rounded decimal-minutes string.
 */
public final class CoordinateDecomposer {
    private static final Logger logger = LoggerFactory.getLogger(CoordinateDecomposer.class);

    public static final int DEFAULT_DECIMAL_MINUTES_SCALE = 5;
    public static final RoundingMode DEFAULT_DECIMAL_MINUTES_ROUNDING = RoundingMode.HALF_UP;

    private final int decimalMinutesScale;
    private final RoundingMode decimalMinutesRounding;

    public CoordinateDecomposer() {
        this(DEFAULT_DECIMAL_MINUTES_SCALE, DEFAULT_DECIMAL_MINUTES_ROUNDING);
    }

    /**
     * @param decimalMinutesScale    digits kept after the decimal point of the decimal minutes
     * @param decimalMinutesRounding how the decimal minutes are rounded to that scale
     * @throws IllegalArgumentException if the scale is negative or the mode is UNNECESSARY
     */
    public CoordinateDecomposer(final int decimalMinutesScale, final RoundingMode decimalMinutesRounding) {
        Objects.requireNonNull(decimalMinutesRounding, "decimalMinutesRounding is required");
        if (decimalMinutesScale < 0) {
            throw new IllegalArgumentException("Decimal minutes scale must not be negative, got: " + decimalMinutesScale);
        }
        if (decimalMinutesRounding == RoundingMode.UNNECESSARY) {
            throw new IllegalArgumentException("Decimal minutes need a rounding mode that can round");
        }
        this.decimalMinutesScale = decimalMinutesScale;
        this.decimalMinutesRounding = decimalMinutesRounding;
    }

    /**
     * Decomposes {@code value} into its display parts.
     *
     * @param value angle in decimal degrees
     * @return the decomposed angle, sign kept in {@link DecomposedAngle#positive()}
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public DecomposedAngle decompose(final double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot decompose a non-finite angle: " + value);
        }
        final boolean positive = value >= 0;
        final double abs = Math.abs(value);

        final int degrees = (int) Math.floor(abs);
        final double minutesFloat = (abs - degrees) * 60;
        final int minutes = (int) Math.floor(minutesFloat);
        final long seconds = Math.round((minutesFloat - minutes) * 60);

        final String decimalMinutes = BigDecimal.valueOf(minutesFloat)
                .setScale(decimalMinutesScale, decimalMinutesRounding)
                .stripTrailingZeros()
                .toPlainString();

        final DecomposedAngle angle = new DecomposedAngle(positive, degrees, minutes, seconds, decimalMinutes);
        logger.debug("Decomposed {} into {}", value, angle);
        return angle;
    }

    public int getDecimalMinutesScale() {
        return decimalMinutesScale;
    }

    public RoundingMode getDecimalMinutesRounding() {
        return decimalMinutesRounding;
    }
}
