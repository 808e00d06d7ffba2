package co.fanki.testaddress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Test Address Resolver Application.
 *
 * <p>Resolves the test specifiers users type, and the test entities a
 * discovery walk meets, into one canonical address: the source file, the
 * dotted module and the dotted callable of a test. Runs as a web service, or
 * as a command line tool with the {@code cli} profile, in which case the
 * process exits once the arguments are resolved.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class TestAddressApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        final ConfigurableApplicationContext context =
                SpringApplication.run(TestAddressApplication.class, args);
        if (context.getEnvironment().getProperty(
                "testaddress.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }

}
