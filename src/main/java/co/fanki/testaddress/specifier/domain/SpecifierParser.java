package co.fanki.testaddress.specifier.domain;

import co.fanki.testaddress.address.domain.DraftAddress;
import co.fanki.testaddress.path.domain.PathLocator;
import co.fanki.testaddress.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.InvalidPathException;
import java.util.Arrays;

/**
 * Parses a test specifier typed by a user into a {@link DraftAddress}.
 *
 * <p>Specifier syntax: {@code location[:callable]}, where the location is
 * either a path or a dotted module name and either side may be dotted.</p>
 *
 * <p>A colon may also be part of the path itself, for example after a
 * drive letter. The parser uses the last directory separator to tell the
 * cases apart:</p>
 * <ul>
 *   <li>{@code com.acme.FooTest:FooTest.testSave} - module and callable</li>
 *   <li>{@code src/test/java/FooTest.java:FooTest.testSave} - path and
 *       callable</li>
 *   <li>{@code c:\tests\FooTest.java:testSave} - drive letter, path and
 *       callable</li>
 *   <li>{@code build:out/} - a colon inside a directory path</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SpecifierParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            SpecifierParser.class);

    private final PathLocator locator;

    /**
     * Creates a parser.
     *
     * @param theLocator the locator used to classify and normalize locations
     */
    public SpecifierParser(final PathLocator theLocator) {
        this.locator = Preconditions.requireNonNull(theLocator,
                "Path locator is required");
    }

    /**
     * Parses a specifier.
     *
     * @param specifier the raw specifier
     * @return the draft address; never all parts empty
     * @throws MalformedSpecifierException if the specifier is blank or has a
     *         colon pattern that cannot be split without guessing
     */
    public DraftAddress parse(final String specifier) {
        if (specifier == null || specifier.isBlank()) {
            throw new MalformedSpecifierException(specifier);
        }

        try {
            final DraftAddress draft = split(specifier);
            LOG.debug("Parsed specifier {} into {}", specifier, draft);
            return draft;
        } catch (final InvalidPathException e) {
            throw new MalformedSpecifierException(specifier, e);
        }
    }

    private DraftAddress split(final String specifier) {
        if (specifier.indexOf(':') < 0) {
            return classify(specifier, null);
        }

        final int separator = PathLocator.lastSeparatorIndex(specifier);
        final String head = separator < 0
                ? ""
                : stripTrailingSeparators(specifier.substring(0, separator + 1));
        final String tail = specifier.substring(separator + 1);

        if (head.isEmpty()) {
            return splitWithoutDirectory(specifier);
        }

        if (tail.isEmpty()) {
            return classify(specifier, null);
        }

        final String[] tailParts = tail.split(":", -1);
        if (tailParts.length > 2) {
            throw new MalformedSpecifierException(specifier);
        }
        final String location = head + File.separator + tailParts[0];
        final String callable = tailParts.length == 2 ? tailParts[1] : null;
        return classify(location, callable);
    }

    /**
     * Splits a specifier with no directory part, such as {@code mod:func}
     * or a drive letter followed by a path.
     */
    private DraftAddress splitWithoutDirectory(final String specifier) {
        final String[] parts = specifier.split(":", -1);

        if (parts.length == 2) {
            if (locator.looksLikePath(parts[1])) {
                return classify(specifier, null);
            }
            return classify(parts[0], parts[1]);
        }

        if (parts[0].length() == 1) {
            final String location = String.join(":",
                    Arrays.copyOf(parts, parts.length - 1));
            return classify(location, parts[parts.length - 1]);
        }

        LOG.warn("Cannot split specifier {}", specifier);
        throw new MalformedSpecifierException(specifier);
    }

    private DraftAddress classify(final String location,
            final String rawCallable) {
        final String callable = rawCallable == null || rawCallable.isEmpty()
                ? null
                : rawCallable;
        if (location.isEmpty()) {
            return new DraftAddress(null, null, callable);
        }
        if (locator.looksLikePath(location)) {
            return new DraftAddress(locator.normalize(location), null,
                    callable);
        }
        return new DraftAddress(null, location, callable);
    }

    /**
     * Drops the separators a head ends with, unless it is made of
     * separators only.
     */
    private static String stripTrailingSeparators(final String head) {
        int end = head.length();
        while (end > 0 && PathLocator.lastSeparatorIndex(
                head.substring(0, end)) == end - 1) {
            end--;
        }
        return end == 0 ? head : head.substring(0, end);
    }

}
