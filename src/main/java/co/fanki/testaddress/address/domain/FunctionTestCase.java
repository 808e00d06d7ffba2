package co.fanki.testaddress.address.domain;

/**
 * A legacy test case adapter that wraps a single test function.
 *
 * <p>Its address is the address of the wrapped function.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FunctionTestCase {

    /**
     * Returns the wrapped function, usually a static {@code Method}.
     *
     * @return the wrapped entity
     */
    Object testFunction();

}
