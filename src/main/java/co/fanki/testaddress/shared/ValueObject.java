package co.fanki.testaddress.shared;

import java.io.Serializable;

/**
 * Marker for immutable values compared by their attributes.
 *
 * <p>Addresses are value objects: two addresses naming the same file,
 * module and callable are the same address, whatever produced them.
 * Implementations validate in their constructor and override
 * {@code equals} and {@code hashCode} over all their attributes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
