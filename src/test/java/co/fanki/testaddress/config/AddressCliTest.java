package co.fanki.testaddress.config;

import co.fanki.testaddress.address.application.AddressService;
import co.fanki.testaddress.address.domain.Address;
import co.fanki.testaddress.specifier.domain.MalformedSpecifierException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for AddressCli.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AddressCliTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private AddressService addressService;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        addressService = createMock(AddressService.class);
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    @Test
    void whenRunning_givenSpecifiers_shouldPrintOneLineEach() throws Exception {
        expect(addressService.resolve("com.acme.FooTest:FooTest")).andReturn(
                Address.of(null, "com.acme.FooTest", "FooTest"));
        expect(addressService.resolve("a:b:c")).andThrow(
                new MalformedSpecifierException("a:b:c"));
        replay(addressService);

        final int failures = new AddressCli(addressService, objectMapper).run(
                new String[] {"--spring.profiles.active=cli",
                        "com.acme.FooTest:FooTest", "a:b:c"}, out);

        final String[] lines = buffer.toString(StandardCharsets.UTF_8)
                .split("\\R");
        assertEquals(1, failures);
        assertEquals(2, lines.length);

        final JsonNode resolved = objectMapper.readTree(lines[0]);
        assertEquals("com.acme.FooTest", resolved.get("module").asText());
        assertEquals("com.acme.FooTest:FooTest",
                resolved.get("specifier").asText());

        final JsonNode failed = objectMapper.readTree(lines[1]);
        assertEquals("a:b:c", failed.get("specifier").asText());
        assertEquals(MalformedSpecifierException.CODE,
                failed.get("errorCode").asText());
        verify(addressService);
    }

    @Test
    void whenRunningAsRunner_givenFailingSpecifier_shouldExitWithOne() {
        expect(addressService.resolve("a:b:c")).andThrow(
                new MalformedSpecifierException("a:b:c"));
        replay(addressService);
        final AddressCli cli = new AddressCli(addressService, objectMapper);

        cli.run("a:b:c");

        assertEquals(1, cli.getExitCode());
        verify(addressService);
    }

    @Test
    void whenRunningAsRunner_givenResolvableSpecifier_shouldExitWithZero() {
        expect(addressService.resolve("com.acme.FooTest")).andReturn(
                Address.of(null, "com.acme.FooTest", null));
        replay(addressService);
        final AddressCli cli = new AddressCli(addressService, objectMapper);

        cli.run("com.acme.FooTest");

        assertEquals(0, cli.getExitCode());
        verify(addressService);
    }

    @Test
    void whenRunning_givenOnlyOptions_shouldPrintNothing() {
        replay(addressService);

        final int failures = new AddressCli(addressService, objectMapper)
                .run(new String[] {"--debug"}, out);

        assertEquals(0, failures);
        assertEquals("", buffer.toString(StandardCharsets.UTF_8));
    }

}
