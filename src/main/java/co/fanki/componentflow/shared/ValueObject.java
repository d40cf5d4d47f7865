package co.fanki.componentflow.shared;

import java.io.Serializable;

/**
 * Marker interface for the immutable values of the flow model.
 *
 * <p>Implementations are compared by their attributes, validate
 * themselves on construction and never change afterwards. Flow nodes,
 * file keys and conditional renders are all value objects, which is what
 * makes a re-scan after a reset comparable with {@code equals}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
