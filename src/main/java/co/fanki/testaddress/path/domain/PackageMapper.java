package co.fanki.testaddress.path.domain;

import co.fanki.testaddress.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Maps between source paths and dotted module names.
 *
 * <p>A directory is a package when it directly contains a
 * {@code package-info.java} (or its compiled form). A module name is built
 * by walking up from a source file while each ancestor is a package, so
 * {@code src/test/java/com/acme/FooTest.java} maps to
 * {@code com.acme.FooTest} only when both {@code com} and {@code com/acme}
 * carry the marker.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PackageMapper {

    private static final Logger LOG = LoggerFactory.getLogger(
            PackageMapper.class);

    /** The package marker file name. */
    public static final String PACKAGE_MARKER = PathLocator.PACKAGE_MARKER;

    private static final String PACKAGE_MARKER_STEM =
            PathLocator.stripExtension(PACKAGE_MARKER);

    private final PathLocator locator;

    /**
     * Creates a mapper on top of the given locator.
     *
     * @param theLocator the locator used to normalize relative paths
     */
    public PackageMapper(final PathLocator theLocator) {
        this.locator = Preconditions.requireNonNull(theLocator,
                "Path locator is required");
    }

    /**
     * Returns the locator this mapper resolves paths with.
     *
     * @return the locator, never null
     */
    public PathLocator locator() {
        return locator;
    }

    /**
     * Checks if a directory directly contains the package marker.
     *
     * @param path the directory, absolute or relative to the working directory
     * @return true if the path is a package directory
     */
    public boolean isPackageDirectory(final String path) {
        return isPackageDirectory(locator.normalize(path));
    }

    /**
     * Checks if a directory directly contains the package marker.
     *
     * <p>Compiled markers count too, since their source name is the
     * marker.</p>
     *
     * @param directory the directory to check
     * @return true if the directory is a package directory
     */
    public boolean isPackageDirectory(final Path directory) {
        if (!Files.isDirectory(directory)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .map(entry -> PathLocator.sourceNameOf(
                            entry.getFileName().toString()))
                    .anyMatch(PACKAGE_MARKER::equals);
        } catch (final IOException e) {
            throw new UncheckedIOException(
                    "Cannot list directory " + directory, e);
        }
    }

    /**
     * Computes the dotted module name of a source file or package directory.
     *
     * <p>The leaf is the file stem, except for the package marker, which
     * contributes nothing. Ancestors are prepended while they are packages,
     * stopping at the first one that is not.</p>
     *
     * @param path the file or directory, absolute or relative
     * @return the dotted module name, or empty if the path is neither a
     *         source file nor a package directory
     */
    public Optional<String> moduleNameFromPath(final String path) {
        Preconditions.requireNonNull(path, "Path is required");

        final String sourceName = PathLocator.sourceNameOf(path);
        final Path source = locator.normalize(sourceName);
        if (!sourceName.endsWith(PathLocator.SOURCE_EXTENSION)
                && !isPackageDirectory(source)) {
            LOG.debug("{} is neither a source file nor a package", path);
            return Optional.empty();
        }

        final Deque<String> packageChain = new ArrayDeque<>();
        final Path leaf = source.getFileName();
        if (leaf != null) {
            final String stem = PathLocator.stripExtension(leaf.toString());
            if (!PACKAGE_MARKER_STEM.equals(stem)) {
                packageChain.addFirst(stem);
            }
        }

        Path current = source.getParent();
        while (current != null && current.getFileName() != null
                && isPackageDirectory(current)) {
            packageChain.addFirst(current.getFileName().toString());
            current = current.getParent();
        }

        if (packageChain.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join(".", packageChain));
    }

    /**
     * Finds the source file of a dotted module name under the working
     * directory.
     *
     * @param dottedName the module name
     * @return the absolute source file, or empty if it does not exist
     */
    public Optional<Path> pathFromModuleName(final String dottedName) {
        return pathFromModuleName(dottedName, locator.workingDirectory());
    }

    /**
     * Finds the source file of a dotted module name under a base directory.
     *
     * <p>The package marker of a matching directory is preferred over a
     * plain source file of the same name.</p>
     *
     * @param dottedName the module name
     * @param baseDir the directory the module path is relative to
     * @return the absolute source file, or empty if it does not exist
     */
    public Optional<Path> pathFromModuleName(final String dottedName,
            final Path baseDir) {
        Preconditions.requireNonBlank(dottedName, "Module name is required");
        Preconditions.requireNonNull(baseDir, "Base directory is required");

        final Path modulePath = locator.workingDirectory()
                .resolve(baseDir)
                .resolve(dottedName.replace('.', '/'))
                .toAbsolutePath()
                .normalize();

        final List<Path> candidates = List.of(
                modulePath.resolve(PACKAGE_MARKER),
                modulePath.resolveSibling(modulePath.getFileName()
                        + PathLocator.SOURCE_EXTENSION));
        for (final Path candidate : candidates) {
            if (Files.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the source file of a dotted module name under several roots.
     *
     * @param dottedName the module name
     * @param roots the source roots, in order; the first hit wins
     * @return the absolute source file, or empty if no root holds it
     */
    public Optional<Path> pathFromModuleName(final String dottedName,
            final List<Path> roots) {
        Preconditions.requireNonNull(roots, "Source roots are required");
        for (final Path root : roots) {
            final Optional<Path> found = pathFromModuleName(dottedName, root);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

}
