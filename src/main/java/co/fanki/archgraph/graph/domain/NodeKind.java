package co.fanki.archgraph.graph.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether a node lives inside the analyzed repository or outside it.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeKind {

    INTERNAL,

    EXTERNAL;

    /**
     * Returns the lowercase wire name.
     *
     * @return "internal" or "external"
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

}
