package co.fanki.archgraph.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects in the domain model.
 *
 * <p>Value objects are immutable, compared by their attributes and
 * validated on construction. Cache keys and repository coordinates are
 * value objects: two equal instances always address the same entry.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
