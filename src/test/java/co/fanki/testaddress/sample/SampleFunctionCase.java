package co.fanki.testaddress.sample;

import co.fanki.testaddress.address.domain.FunctionTestCase;

/**
 * Wraps a single test function as a test case.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SampleFunctionCase implements FunctionTestCase {

    private final Object function;

    public SampleFunctionCase(final Object theFunction) {
        this.function = theFunction;
    }

    @Override
    public Object testFunction() {
        return function;
    }

}
