package co.fanki.testaddress.address.domain;

/**
 * The older shape of {@link NamedTestCase}, where the test method name is
 * exposed through {@code getName()}, as JUnit 3 test cases do.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 * @deprecated implement {@link NamedTestCase} instead.
 */
@Deprecated
public interface LegacyNamedTestCase {

    /**
     * Returns the name of the test method this instance runs.
     *
     * @return the method name
     */
    String getName();

}
