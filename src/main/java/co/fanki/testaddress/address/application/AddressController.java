package co.fanki.testaddress.address.application;

import co.fanki.testaddress.address.domain.Address;
import co.fanki.testaddress.address.domain.DraftAddress;
import co.fanki.testaddress.module.domain.NameNotFoundException;
import co.fanki.testaddress.path.domain.PathNotFoundException;
import co.fanki.testaddress.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller exposing specifier resolution.
 *
 * <p>Specifier syntax: {@code location[:callable]}, where the location is a
 * path or a dotted module name.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/addresses")
@Tag(name = "Addresses",
        description = "Resolve test specifiers into canonical addresses")
public class AddressController {

    private static final Logger LOG = LoggerFactory.getLogger(
            AddressController.class);

    private final AddressService addressService;

    /**
     * Creates a new AddressController.
     *
     * @param theAddressService the address service
     */
    public AddressController(final AddressService theAddressService) {
        this.addressService = theAddressService;
    }

    /**
     * Resolves a specifier into its canonical address.
     *
     * @param specifier the specifier, e.g. {@code com.acme.FooTest:FooTest.testSave}
     * @return the address, or an error body
     */
    @GetMapping
    @Operation(summary = "Resolve a test specifier",
            description = "Parses the specifier, binds it to the test it"
                    + " names and returns its file, module and callable."
                    + " Examples: com.acme.FooTest,"
                    + " src/test/java/com/acme/FooTest.java:FooTest.testSave")
    public ResponseEntity<?> resolve(
            @RequestParam("specifier") final String specifier) {
        try {
            final Address address = addressService.resolve(specifier);
            return ResponseEntity.ok(AddressView.from(address));
        } catch (final DomainException e) {
            return failure(e);
        }
    }

    /**
     * Parses a specifier without resolving it.
     *
     * @param request the request holding the specifier
     * @return the draft address, or an error body
     */
    @PostMapping("/draft")
    @Operation(summary = "Parse a test specifier",
            description = "Splits the specifier into file, module and"
                    + " callable without looking anything up.")
    public ResponseEntity<?> draft(
            @RequestBody final SpecifierRequest request) {
        try {
            final DraftAddress draft = addressService.draft(
                    request.specifier());
            return ResponseEntity.ok(new DraftView(
                    draft.hasFile() ? draft.file().toString() : null,
                    draft.module(),
                    draft.callable()));
        } catch (final DomainException e) {
            return failure(e);
        }
    }

    private ResponseEntity<?> failure(final DomainException e) {
        LOG.warn("Address request failed: {}", e.getMessage());
        final HttpStatus status = switch (e.getErrorCode()) {
            case NameNotFoundException.CODE, PathNotFoundException.CODE ->
                    HttpStatus.NOT_FOUND;
            default -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(
                Map.of("error", e.getMessage(),
                        "errorCode", e.getErrorCode()));
    }

    /**
     * Request body for parsing.
     *
     * @param specifier the raw specifier
     */
    public record SpecifierRequest(String specifier) {}

    /**
     * A parsed, unresolved specifier.
     *
     * @param file the absolute path, or null
     * @param module the dotted module name, or null
     * @param callable the callable, or null
     */
    public record DraftView(String file, String module, String callable) {}
}
