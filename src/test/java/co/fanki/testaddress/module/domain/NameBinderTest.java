package co.fanki.testaddress.module.domain;

import co.fanki.testaddress.address.domain.Address;
import co.fanki.testaddress.address.domain.AddressResolver;
import co.fanki.testaddress.path.domain.PackageMapper;
import co.fanki.testaddress.path.domain.PathLocator;
import co.fanki.testaddress.path.domain.SourceRoots;
import co.fanki.testaddress.sample.SampleUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.nio.file.Path;
import java.util.List;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for NameBinder.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class NameBinderTest {

    private static final String SAMPLE = "co.fanki.testaddress.sample";
    private static final String UNIT = SAMPLE + ".SampleUnit";

    private ModuleLoader loader;
    private NameBinder binder;

    @BeforeEach
    void setUp() {
        loader = new ClassPathModuleLoader(getClass().getClassLoader(),
                new PackageMapper(PathLocator.forCurrentDirectory()),
                new SourceRoots(List.of(
                        Path.of("src/test/java").toAbsolutePath())));
        binder = new NameBinder(loader);
    }

    @Test
    void whenBinding_givenUnitName_shouldReturnItsModule() {
        final Object bound = binder.bind(UNIT);

        final LoadedModule module = assertInstanceOf(LoadedModule.class, bound);
        assertEquals(UNIT, module.name());
        assertFalse(module.isPackage());
        assertTrue(module.file().isPresent());
    }

    @Test
    void whenBinding_givenPackageName_shouldReturnAPackageModule() {
        final LoadedModule module = assertInstanceOf(LoadedModule.class,
                binder.bind(SAMPLE));

        assertTrue(module.isPackage());
    }

    @Test
    void whenBinding_givenUnitClassName_shouldReturnTheTopLevelClass() {
        final Object bound = binder.bind(UNIT + ".SampleUnit");

        assertSame(SampleUnit.class, bound);
    }

    @Test
    void whenBinding_givenFunctionName_shouldReturnTheStaticMethod()
            throws NoSuchMethodException {
        final Object bound = binder.bind(UNIT + ".staticCheck");

        assertEquals(SampleUnit.class.getMethod("staticCheck"), bound);
    }

    @Test
    void whenBinding_givenOverloadedMethod_shouldPreferFewestParameters() {
        final Method method = assertInstanceOf(Method.class,
                binder.bind(UNIT + ".SampleUnit.testSave"));

        assertEquals(0, method.getParameterCount());
    }

    @Test
    void whenBinding_givenNestedClassMethod_shouldWalkThroughTheNestedClass()
            throws NoSuchMethodException {
        final Object bound = binder.bind(UNIT + ".Nested.testInner");

        assertEquals(SampleUnit.Nested.class.getMethod("testInner"), bound);
    }

    @Test
    void whenBinding_givenResolvedAddress_shouldRoundTrip() {
        final AddressResolver resolver = new AddressResolver(loader);
        final Address address = resolver.resolve(SampleUnit.Nested.class);

        final Object bound = binder.bind(address.module() + "."
                + address.callable());

        assertSame(SampleUnit.Nested.class, bound);
        assertEquals(address, resolver.resolve(bound));
    }

    @Test
    void whenBinding_givenMissingAttribute_shouldNameTheSegment() {
        final NameNotFoundException e = assertThrows(
                NameNotFoundException.class,
                () -> binder.bind(UNIT + ".Nested.missing"));

        assertEquals("missing", e.getSegment());
        assertEquals(6, e.getPosition());
        assertEquals(UNIT + ".Nested.missing", e.getName());
        assertEquals(NameNotFoundException.CODE, e.getErrorCode());
    }

    @Test
    void whenBinding_givenSegmentAfterAMethod_shouldNotFindIt() {
        final NameNotFoundException e = assertThrows(
                NameNotFoundException.class,
                () -> binder.bind(UNIT + ".staticCheck.name"));

        assertEquals("name", e.getSegment());
        assertEquals(6, e.getPosition());
    }

    @Test
    void whenBinding_givenUnknownModule_shouldKeepTheImportFailure() {
        final NameNotFoundException e = assertThrows(
                NameNotFoundException.class,
                () -> binder.bind("no.such.module"));

        assertEquals("no", e.getSegment());
        assertEquals(0, e.getPosition());
        assertInstanceOf(ModuleImportException.class, e.getCause());
    }

    @Test
    void whenBinding_givenMalformedName_shouldFail() {
        assertThrows(NameNotFoundException.class,
                () -> binder.bind("com..acme"));
        assertThrows(IllegalArgumentException.class,
                () -> binder.bind(" "));
    }

    @Test
    void whenBinding_givenUnimportableTail_shouldShrinkThePrefix() {
        final ModuleLoader mock = createMock(ModuleLoader.class);
        expect(mock.importModule("com.acme.FooTest.testSave")).andThrow(
                new ModuleImportException("com.acme.FooTest.testSave", null));
        expect(mock.importModule("com.acme.FooTest")).andReturn(
                LoadedModule.unit("com.acme.FooTest", SampleUnit.class, null));
        replay(mock);

        final Object bound = new NameBinder(mock).bind(
                "com.acme.FooTest.testSave");

        final Method method = assertInstanceOf(Method.class, bound);
        assertEquals("testSave", method.getName());
        verify(mock);
    }

    @Test
    void whenBinding_givenMissingPackageChild_shouldReportTheChild() {
        final ModuleLoader mock = createMock(ModuleLoader.class);
        expect(mock.importModule("pkg.Child")).andThrow(
                new ModuleImportException("pkg.Child", null)).times(2);
        expect(mock.importModule("pkg")).andReturn(
                LoadedModule.pkg("pkg", null));
        replay(mock);

        final NameNotFoundException e = assertThrows(
                NameNotFoundException.class,
                () -> new NameBinder(mock).bind("pkg.Child"));

        assertEquals("Child", e.getSegment());
        assertEquals(1, e.getPosition());
        verify(mock);
    }

}
