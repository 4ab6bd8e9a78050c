package ou.capstone.geoconvert.format;

import java.util.Objects;

/**
 * Binds a template token to one field of either the latitude or the longitude.
 */
public record FieldSelector(Axis axis, AngleField field) {

    public FieldSelector {
        Objects.requireNonNull(axis, "axis is required");
        Objects.requireNonNull(field, "field is required");
    }

    public static FieldSelector latitude(final AngleField field) {
        return new FieldSelector(Axis.LATITUDE, field);
    }

    public static FieldSelector longitude(final AngleField field) {
        return new FieldSelector(Axis.LONGITUDE, field);
    }

    /** Picks the angle matching {@link #axis()} and renders {@link #field()} from it. */
    public String select(final DecomposedAngle latitude, final DecomposedAngle longitude) {
        return axis == Axis.LATITUDE
                ? field.render(latitude, axis)
                : field.render(longitude, axis);
    }
}
