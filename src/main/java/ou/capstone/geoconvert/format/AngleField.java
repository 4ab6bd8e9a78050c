package ou.capstone.geoconvert.format;

/**
 * The parts of a decomposed angle a template can refer to.
 */
public enum AngleField {
    SIGN {
        @Override
        public String render(final DecomposedAngle angle, final Axis axis) {
            return angle.positive() ? "" : "-";
        }
    },
    DIRECTION {
        @Override
        public String render(final DecomposedAngle angle, final Axis axis) {
            return String.valueOf(axis.direction(angle.positive()));
        }
    },
    DEGREES {
        @Override
        public String render(final DecomposedAngle angle, final Axis axis) {
            return String.valueOf(angle.degrees());
        }
    },
    MINUTES {
        @Override
        public String render(final DecomposedAngle angle, final Axis axis) {
            return String.valueOf(angle.minutes());
        }
    },
    SECONDS {
        @Override
        public String render(final DecomposedAngle angle, final Axis axis) {
            return String.valueOf(angle.seconds());
        }
    },
    DECIMAL_MINUTES {
        @Override
        public String render(final DecomposedAngle angle, final Axis axis) {
            return angle.decimalMinutes();
        }
    };

    /**
     * Renders this field of {@code angle} as display text.
     *
     * @param angle the decomposed angle
     * @param axis  latitude or longitude, used for the hemisphere letter
     * @return the text substituted for a token bound to this field
     */
    public abstract String render(DecomposedAngle angle, Axis axis);
}
