package co.fanki.testaddress;

import co.fanki.testaddress.address.application.AddressService;
import co.fanki.testaddress.address.domain.Address;
import co.fanki.testaddress.sample.SampleNamedCase;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End to end tests of the address endpoints over the sample classes.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AddressApiIntegrationTest {

    private static final String UNIT = "co.fanki.testaddress.sample.SampleUnit";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AddressService addressService;

    @Test
    void whenResolving_givenNestedTestMethod_shouldReturnItsAddress()
            throws Exception {
        mockMvc.perform(get("/api/addresses")
                        .param("specifier", UNIT + ":SampleUnit.Nested.testInner"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.module").value(UNIT))
                .andExpect(jsonPath("$.callable")
                        .value("SampleUnit.Nested.testInner"))
                .andExpect(jsonPath("$.file").value(Path.of("src/test/java")
                        .toAbsolutePath().normalize()
                        .resolve("co/fanki/testaddress/sample/SampleUnit.java")
                        .toString()));
    }

    @Test
    void whenResolving_givenUnknownCallable_shouldAnswerNotFound()
            throws Exception {
        mockMvc.perform(get("/api/addresses")
                        .param("specifier", UNIT + ":SampleUnit.missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NAME_NOT_FOUND"));
    }

    @Test
    void whenResolving_givenMalformedSpecifier_shouldAnswerBadRequest()
            throws Exception {
        mockMvc.perform(get("/api/addresses").param("specifier", "foo:bar:baz"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode")
                        .value("MALFORMED_SPECIFIER"));
    }

    @Test
    void whenDrafting_givenModuleSpecifier_shouldSplitWithoutLookup()
            throws Exception {
        mockMvc.perform(post("/api/addresses/draft")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"specifier\":\"com.acme.Missing:testX\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.module").value("com.acme.Missing"))
                .andExpect(jsonPath("$.callable").value("testX"));
    }

    @Test
    void whenResolvingEntity_givenTestCase_shouldMatchItsSpecifier() {
        final Address fromEntity = addressService.resolveEntity(
                new SampleNamedCase("testOne"));

        final Address fromSpecifier = addressService.resolve(
                fromEntity.toSpecifier());

        assertEquals(fromEntity, fromSpecifier);
    }

}
