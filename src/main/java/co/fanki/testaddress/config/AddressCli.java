package co.fanki.testaddress.config;

import co.fanki.testaddress.address.application.AddressService;
import co.fanki.testaddress.address.application.AddressView;
import co.fanki.testaddress.shared.DomainException;
import co.fanki.testaddress.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves the specifiers given on the command line, one JSON line each.
 *
 * <p>Arguments starting with {@code --} are Spring options and are
 * skipped. A specifier that fails prints an error line instead and the
 * remaining specifiers are still resolved. The exit code is 1 when any
 * specifier failed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AddressCli implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(
            AddressCli.class);

    private final AddressService addressService;
    private final ObjectMapper objectMapper;

    private volatile int failures;

    /**
     * Creates the command line front end.
     *
     * @param theAddressService the address service
     * @param theObjectMapper the mapper lines are written with
     */
    public AddressCli(final AddressService theAddressService,
            final ObjectMapper theObjectMapper) {
        this.addressService = Preconditions.requireNonNull(theAddressService,
                "Address service is required");
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required");
    }

    /**
     * Resolves the program arguments to standard output.
     *
     * @param args the program arguments
     */
    @Override
    public void run(final String... args) {
        failures = run(args, System.out);
        LOG.info("Resolved {} arguments, {} failed", args.length, failures);
    }

    /**
     * Returns 1 if the last run had failures, 0 otherwise.
     *
     * @return the process exit code
     */
    @Override
    public int getExitCode() {
        return failures > 0 ? 1 : 0;
    }

    /**
     * Resolves each specifier argument.
     *
     * @param args the program arguments
     * @param out where the JSON lines are written
     * @return the number of specifiers that failed
     */
    public int run(final String[] args, final PrintStream out) {
        int failures = 0;
        for (final String arg : args) {
            if (arg.startsWith("--")) {
                continue;
            }
            Object line;
            try {
                line = AddressView.from(addressService.resolve(arg));
            } catch (final DomainException e) {
                LOG.warn("Cannot resolve {}: {}", arg, e.getMessage());
                final Map<String, String> error = new LinkedHashMap<>();
                error.put("specifier", arg);
                error.put("error", e.getMessage());
                error.put("errorCode", e.getErrorCode());
                line = error;
                failures++;
            }
            out.println(write(line));
        }
        return failures;
    }

    private String write(final Object line) {
        try {
            return objectMapper.writeValueAsString(line);
        } catch (final JsonProcessingException e) {
            throw new UncheckedIOException("Cannot write " + line, e);
        }
    }

}
