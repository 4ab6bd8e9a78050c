package ou.capstone.geoconvert.format;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * Fills a template with the fields of a decomposed latitude and longitude.
 * <p>
 * All tokens are replaced in one left-to-right pass, so text produced by a
 * replacement is never scanned again. Text that is not a known token is copied
 * through unchanged. Where several tokens match at the same position the
 * longest one wins.
 */
public final class FormatRenderer {

    /**
     * @param template     the format, e.g. {@link Placeholders#DEFAULT_DMS_FORMAT}
     * @param latitude     decomposed latitude
     * @param longitude    decomposed longitude
     * @param placeholders token to field mapping
     * @return the rendered string
     */
    public String render(final String template,
                         final DecomposedAngle latitude,
                         final DecomposedAngle longitude,
                         final Map<String, FieldSelector> placeholders) {
        Objects.requireNonNull(template, "template is required");
        Objects.requireNonNull(latitude, "latitude is required");
        Objects.requireNonNull(longitude, "longitude is required");
        Objects.requireNonNull(placeholders, "placeholders are required");

        // Longest token first, so "%DD" is matched before "%D" at the same position.
        // List.sort is stable: equal lengths keep the mapping's order.
        final List<Map.Entry<String, FieldSelector>> entries = new ArrayList<>(placeholders.entrySet());
        entries.sort(Comparator.comparingInt((Map.Entry<String, FieldSelector> e) -> e.getKey().length()).reversed());

        final String[] tokens = new String[entries.size()];
        final String[] values = new String[entries.size()];
        int i = 0;
        for (final Map.Entry<String, FieldSelector> entry : entries) {
            tokens[i] = entry.getKey();
            values[i] = entry.getValue().select(latitude, longitude);
            i++;
        }
        return StringUtils.replaceEach(template, tokens, values);
    }
}
