package co.fanki.testaddress.path.domain;

import co.fanki.testaddress.shared.Preconditions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The directories module names are resolved under, in lookup order.
 *
 * @param roots the absolute source root directories
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceRoots(List<Path> roots) {

    /**
     * Copies the roots into an unmodifiable list.
     *
     * @param roots the absolute source root directories
     */
    public SourceRoots {
        Preconditions.requireNonNull(roots, "Source roots are required");
        roots = List.copyOf(roots);
    }

    /**
     * Builds the roots from configured names, relative to the locator's
     * working directory.
     *
     * <p>Roots are kept even when they do not exist yet; lookups under a
     * missing root simply find nothing.</p>
     *
     * @param locator the locator to normalize with
     * @param names the configured root names
     * @return the source roots
     */
    public static SourceRoots of(final PathLocator locator,
            final List<String> names) {
        final List<Path> roots = new ArrayList<>();
        for (final String name : names) {
            if (name != null && !name.isBlank()) {
                roots.add(locator.normalize(name.trim()));
            }
        }
        return new SourceRoots(roots);
    }

}
