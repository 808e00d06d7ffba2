package co.fanki.testaddress.address.domain;

/**
 * A test case instance that runs one named method of its class.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface NamedTestCase {

    /**
     * Returns the name of the test method this instance runs.
     *
     * @return the method name
     */
    String testMethodName();

}
