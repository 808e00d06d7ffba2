package co.fanki.testaddress.address.domain;

/**
 * An entity that knows its own address.
 *
 * <p>When an entity implements this, its answer is used as is and no other
 * inspection takes place.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface Addressable {

    /**
     * Returns the address of this entity.
     *
     * @return the address, never null
     */
    Address address();

}
