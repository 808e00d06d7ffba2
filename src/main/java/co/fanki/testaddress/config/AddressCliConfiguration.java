package co.fanki.testaddress.config;

import co.fanki.testaddress.address.application.AddressService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Runs the resolver as a command line tool.
 *
 * <p>Enabled when {@code testaddress.cli.enabled} is {@code true}, which the
 * {@code cli} profile sets together with disabling the web server. The
 * {@link AddressCli} bean is both the runner and the exit code
 * generator.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "testaddress.cli.enabled", havingValue = "true")
public class AddressCliConfiguration {

    @Bean
    AddressCli addressCli(final AddressService addressService,
            final ObjectMapper objectMapper) {
        return new AddressCli(addressService, objectMapper);
    }

}
