package co.fanki.testaddress.module.domain;

import co.fanki.testaddress.sample.SamplePlain;
import co.fanki.testaddress.sample.SampleUnit;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for Members and BoundMethod.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MembersTest {

    /** Inherits everything from the sample unit. */
    static class Derived extends SampleUnit {

        @Override
        public void testSave() {
        }

    }

    @Test
    void whenFindingMethods_givenOverloads_shouldSortByParameterCount() {
        final List<Method> methods = Members.methods(SampleUnit.class,
                "testSave");

        assertEquals(2, methods.size());
        assertEquals(0, methods.get(0).getParameterCount());
        assertEquals(1, methods.get(1).getParameterCount());
    }

    @Test
    void whenFindingMethods_givenOverride_shouldReturnTheClosestDeclaration() {
        final List<Method> methods = Members.methods(Derived.class, "testSave");

        assertEquals(2, methods.size());
        assertSame(Derived.class, methods.get(0).getDeclaringClass());
    }

    @Test
    void whenFindingMembers_givenInheritedNestedClass_shouldFindIt() {
        assertEquals(SampleUnit.Nested.class,
                Members.nestedClass(Derived.class, "Nested").orElseThrow());
        assertTrue(Members.nestedClass(SamplePlain.class, "Nested").isEmpty());
    }

    @Test
    void whenCheckingFields_givenStaticField_shouldFindIt() {
        assertTrue(Members.hasField(SampleUnit.class, "teardownHook"));
        assertFalse(Members.hasField(SampleUnit.class, "missing"));
    }

    @Test
    void whenBinding_givenReceiverOfOtherType_shouldFail()
            throws NoSuchMethodException {
        final Method testInner = SampleUnit.Nested.class.getMethod("testInner");

        assertThrows(IllegalArgumentException.class,
                () -> new BoundMethod(new SamplePlain(), testInner));
    }

    @Test
    void whenBinding_givenSubclassReceiver_shouldBeOwnedByTheSubclass()
            throws NoSuchMethodException {
        final BoundMethod bound = new BoundMethod(new Derived(),
                SampleUnit.class.getMethod("staticCheck"));

        assertEquals(Derived.class, bound.owner());
        assertEquals("staticCheck", bound.name());
    }

}
