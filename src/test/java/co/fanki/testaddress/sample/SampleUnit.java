package co.fanki.testaddress.sample;

import co.fanki.testaddress.module.domain.LoadedModule;

import java.util.ArrayList;
import java.util.List;

/**
 * A compilation unit shaped like a test module: free functions, test
 * methods, a nested test class and module fixtures.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SampleUnit {

    /** Calls recorded by the fixtures, in order. */
    public static final List<String> CALLS = new ArrayList<>();

    /** Not a method, so it cannot be run as a fixture. */
    public static String teardownHook = "not callable";

    public static void setUpModule(final LoadedModule module) {
        CALLS.add("setUpModule:" + module.name());
    }

    public static void setup() {
        CALLS.add("setup");
    }

    public static String tearDownModule() {
        CALLS.add("tearDownModule");
        return "done";
    }

    public static void staticCheck() {
    }

    public void testSave() {
    }

    public void testSave(final String label) {
    }

    /** A test class nested in the unit. */
    public static class Nested {

        public void testInner() {
        }

    }

}
