package co.fanki.testaddress.address.application;

import co.fanki.testaddress.address.domain.Address;
import co.fanki.testaddress.address.domain.AddressResolver;
import co.fanki.testaddress.address.domain.DraftAddress;
import co.fanki.testaddress.module.domain.NameBinder;
import co.fanki.testaddress.module.domain.NameNotFoundException;
import co.fanki.testaddress.path.domain.PackageMapper;
import co.fanki.testaddress.path.domain.PathLocator;
import co.fanki.testaddress.path.domain.PathNotFoundException;
import co.fanki.testaddress.path.domain.SourceRoots;
import co.fanki.testaddress.specifier.domain.MalformedSpecifierException;
import co.fanki.testaddress.specifier.domain.SpecifierParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for AddressService.
 *
 * <p>Parsing and file lookups run for real over a throwaway source tree;
 * binding and address computation are mocked.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AddressServiceTest {

    @TempDir
    Path workDir;

    private Path root;
    private NameBinder nameBinder;
    private AddressResolver addressResolver;

    private AddressService service;

    @BeforeEach
    void setUp() throws IOException {
        root = workDir.toRealPath();
        write("src/com/package-info.java");
        write("src/com/acme/package-info.java");
        write("src/com/acme/FooTest.java");
        write("notes.txt");

        final PathLocator locator = new PathLocator(root);
        nameBinder = createMock(NameBinder.class);
        addressResolver = createMock(AddressResolver.class);

        service = new AddressService(
                new SpecifierParser(locator),
                new PackageMapper(locator),
                SourceRoots.of(locator, List.of("src")),
                nameBinder,
                addressResolver);
    }

    @Test
    void whenResolving_givenModuleSpecifier_shouldBindModuleAndCallable() {
        final Object entity = new Object();
        final Address expected = Address.of(
                root.resolve("src/com/acme/FooTest.java"),
                "com.acme.FooTest", "FooTest.testSave");
        expect(nameBinder.bind("com.acme.FooTest.FooTest.testSave"))
                .andReturn(entity);
        expect(addressResolver.resolve(entity)).andReturn(expected);
        replay(nameBinder, addressResolver);

        final Address address = service.resolve(
                "com.acme.FooTest:FooTest.testSave");

        assertSame(expected, address);
        verify(nameBinder, addressResolver);
    }

    @Test
    void whenResolving_givenFileInsidePackages_shouldBindItsModuleAndKeepTheFile() {
        final Object entity = new Object();
        expect(nameBinder.bind("com.acme.FooTest")).andReturn(entity);
        expect(addressResolver.resolve(entity)).andReturn(
                Address.of(null, "com.acme.FooTest", null));
        replay(nameBinder, addressResolver);

        final Address address = service.resolve("src/com/acme/FooTest.java");

        assertEquals(Address.of(root.resolve("src/com/acme/FooTest.java"),
                "com.acme.FooTest", null), address);
        verify(nameBinder, addressResolver);
    }

    @Test
    void whenResolving_givenFileWhoseModuleIsNotLoadable_shouldKeepFileAndModule()
            throws IOException {
        write("loose/Standalone.java");
        expect(nameBinder.bind("Standalone.testX")).andThrow(
                new NameNotFoundException("Standalone.testX", "Standalone",
                        0, null));
        replay(nameBinder, addressResolver);

        final Address address = service.resolve("loose/Standalone.java:testX");

        assertEquals(Address.of(root.resolve("loose/Standalone.java"),
                "Standalone", "testX"), address);
        verify(nameBinder, addressResolver);
    }

    @Test
    void whenResolving_givenFileWhoseModuleLacksTheCallable_shouldFail() {
        expect(nameBinder.bind("com.acme.FooTest.FooTest.missing")).andThrow(
                new NameNotFoundException("com.acme.FooTest.FooTest.missing",
                        "missing", 4, null));
        replay(nameBinder, addressResolver);

        assertThrows(NameNotFoundException.class,
                () -> service.resolve(
                        "src/com/acme/FooTest.java:FooTest.missing"));
        verify(nameBinder, addressResolver);
    }

    @Test
    void whenResolving_givenMissingModuleNamedByTheUser_shouldFail() {
        expect(nameBinder.bind("com.acme.Gone")).andThrow(
                new NameNotFoundException("com.acme.Gone", "Gone", 2, null));
        replay(nameBinder, addressResolver);

        assertThrows(NameNotFoundException.class,
                () -> service.resolve("com.acme.Gone"));
        verify(nameBinder, addressResolver);
    }

    @Test
    void whenResolving_givenFileOutsideAnyModule_shouldKeepTheFileOnly() {
        replay(nameBinder, addressResolver);

        final Address address = service.resolve("notes.txt:check");

        assertEquals(Address.of(root.resolve("notes.txt"), null, "check"),
                address);
        verify(nameBinder, addressResolver);
    }

    @Test
    void whenResolving_givenMissingFile_shouldThrowPathNotFound() {
        replay(nameBinder, addressResolver);

        assertThrows(PathNotFoundException.class,
                () -> service.resolve("src/com/acme/Missing.java:test"));
    }

    @Test
    void whenResolving_givenOnlyACallable_shouldBeMalformed() {
        replay(nameBinder, addressResolver);

        assertThrows(MalformedSpecifierException.class,
                () -> service.resolve(":testSave"));
    }

    @Test
    void whenCompleting_givenModuleDraft_shouldFindItsSourceUnderTheRoots() {
        final DraftAddress completed = service.complete(
                service.draft("com.acme.FooTest:FooTest"));

        assertEquals(root.resolve("src/com/acme/FooTest.java"),
                completed.file());
        assertEquals("com.acme.FooTest", completed.module());
        assertEquals("FooTest", completed.callable());
    }

    @Test
    void whenCompleting_givenUnknownModule_shouldLeaveTheFileEmpty() {
        final DraftAddress completed = service.complete(
                service.draft("com.acme.Missing"));

        assertNull(completed.file());
        assertEquals("com.acme.Missing", completed.module());
    }

    @Test
    void whenResolvingEntity_givenAnyEntity_shouldDelegateToTheResolver() {
        final Address expected = Address.of(null, "com.acme", null);
        expect(addressResolver.resolve("entity")).andReturn(expected);
        replay(nameBinder, addressResolver);

        assertSame(expected, service.resolveEntity("entity"));
        verify(addressResolver);
    }

    private void write(final String relative) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "// " + relative);
    }

}
