package co.fanki.testaddress.address.application;

import co.fanki.testaddress.address.domain.Address;

/**
 * JSON rendition of an {@link Address}.
 *
 * @param file the absolute source file, or null
 * @param module the dotted module name, or null
 * @param callable the dotted callable, or null
 * @param specifier the address rendered back as a specifier
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AddressView(String file, String module, String callable,
        String specifier) {

    /**
     * Builds the view of an address.
     *
     * @param address the address
     * @return the view
     */
    public static AddressView from(final Address address) {
        return new AddressView(address.file(), address.module(),
                address.callable(), address.toSpecifier());
    }

}
