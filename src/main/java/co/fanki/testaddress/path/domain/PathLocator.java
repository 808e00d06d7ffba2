package co.fanki.testaddress.path.domain;

import co.fanki.testaddress.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Locates files and directories on disk, relative to a working directory.
 *
 * <p>Relative references are normalized against the working directory the
 * locator was created with, so that every path it hands out is absolute and
 * normalized. It knows nothing about tests: it only answers where a file is
 * and how a compiled file name maps back to its source file name.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PathLocator {

    private static final Logger LOG = LoggerFactory.getLogger(
            PathLocator.class);

    /** Extension of source files. */
    public static final String SOURCE_EXTENSION = ".java";

    /** Extension of compiled class files. */
    public static final String BYTECODE_EXTENSION = ".class";

    /** The file that marks a directory as a package. */
    public static final String PACKAGE_MARKER = "package-info"
            + SOURCE_EXTENSION;

    /** A bare name that can only be a module, class or method name. */
    private static final Pattern BARE_IDENTIFIER = Pattern.compile(
            "^[A-Za-z_$][A-Za-z0-9_$.]*$");

    private final Path workingDirectory;

    /**
     * Creates a locator bound to the given working directory.
     *
     * @param theWorkingDirectory the directory relative paths resolve against
     */
    public PathLocator(final Path theWorkingDirectory) {
        Preconditions.requireNonNull(theWorkingDirectory,
                "Working directory is required");
        this.workingDirectory = theWorkingDirectory.toAbsolutePath()
                .normalize();
    }

    /**
     * Creates a locator bound to the process working directory.
     *
     * @return the locator, never null
     */
    public static PathLocator forCurrentDirectory() {
        return new PathLocator(Paths.get(""));
    }

    /**
     * Returns the directory relative paths are resolved against.
     *
     * @return the absolute, normalized working directory
     */
    public Path workingDirectory() {
        return workingDirectory;
    }

    /**
     * Makes a path absolute against the working directory and normalizes it.
     *
     * <p>The path is not required to exist.</p>
     *
     * @param path the path to normalize
     * @return the absolute, normalized path
     */
    public Path normalize(final String path) {
        Preconditions.requireNonNull(path, "Path is required");
        return against(workingDirectory, path);
    }

    /**
     * Resolves a directory reference.
     *
     * @param path the directory, absolute or relative to the working directory
     * @return the absolute directory, or empty if it is not an existing
     *         directory
     */
    public Optional<Path> resolveDirectory(final String path) {
        Preconditions.requireNonNull(path, "Path is required");
        final Path candidate = normalize(path);
        if (!Files.isDirectory(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    /**
     * Resolves a directory reference, failing when it does not exist.
     *
     * @param path the directory, absolute or relative to the working directory
     * @return the absolute directory
     * @throws PathNotFoundException if the directory does not exist
     */
    public Path requireDirectory(final String path) {
        return resolveDirectory(path).orElseThrow(
                () -> new PathNotFoundException(path, List.of(workingDirectory)));
    }

    /**
     * Resolves a file relative to the working directory.
     *
     * @param path the file, absolute or relative
     * @return the absolute file, or empty if it cannot be found
     */
    public Optional<Path> resolveFile(final String path) {
        return resolveFile(path, workingDirectory);
    }

    /**
     * Resolves a file against a sequence of candidate bases.
     *
     * <p>Bases are tried in order and the first hit wins. An empty sequence
     * means the working directory.</p>
     *
     * @param path the file, absolute or relative
     * @param bases the candidate base directories, in order
     * @return the absolute file, or empty if no base contains it
     */
    public Optional<Path> resolveFile(final String path,
            final List<Path> bases) {
        Preconditions.requireNonNull(bases, "Search bases are required");
        if (bases.isEmpty()) {
            return resolveFile(path);
        }
        for (final Path base : bases) {
            final Optional<Path> found = resolveFile(path, base);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a file against a single base directory.
     *
     * <p>A relative path is first looked up under the base. When it is not
     * there and the base is not the working directory, the original path is
     * looked up under the working directory instead. A directory resolves to
     * its package marker file, never to itself.</p>
     *
     * @param path the file, absolute or relative
     * @param base the base directory
     * @return the absolute file, or empty if it cannot be found
     */
    public Optional<Path> resolveFile(final String path, final Path base) {
        Preconditions.requireNonNull(path, "Path is required");
        Preconditions.requireNonNull(base, "Search base is required");

        final Path normalizedBase = workingDirectory.resolve(base)
                .toAbsolutePath().normalize();

        Path candidate = against(normalizedBase, path);
        if (!Files.exists(candidate)
                && !normalizedBase.equals(workingDirectory)) {
            LOG.debug("{} not found under {}, trying {}", path,
                    normalizedBase, workingDirectory);
            candidate = against(workingDirectory, path);
        }

        if (Files.isDirectory(candidate)) {
            final Path marker = candidate.resolve(PACKAGE_MARKER);
            if (Files.isRegularFile(marker)) {
                return Optional.of(marker);
            }
            return Optional.empty();
        }
        if (Files.isRegularFile(candidate)) {
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    /**
     * Resolves a file against a sequence of bases, failing when it is
     * missing.
     *
     * @param path the file, absolute or relative
     * @param bases the candidate base directories, in order
     * @return the absolute file
     * @throws PathNotFoundException if no base contains the file
     */
    public Path requireFile(final String path, final List<Path> bases) {
        return resolveFile(path, bases).orElseThrow(
                () -> new PathNotFoundException(path,
                        bases.isEmpty() ? List.of(workingDirectory) : bases));
    }

    /**
     * Tells whether a name refers to a file rather than a dotted name.
     *
     * <p>A name is path-like when it exists on disk, has a directory part,
     * ends with the source extension, or is not a bare identifier once its
     * last extension is removed.</p>
     *
     * @param name the name to classify
     * @return true if the name should be treated as a path
     */
    public boolean looksLikePath(final String name) {
        Preconditions.requireNonNull(name, "Name is required");
        return exists(name)
                || lastSeparatorIndex(name) >= 0
                || name.endsWith(SOURCE_EXTENSION)
                || !BARE_IDENTIFIER.matcher(stripExtension(name)).matches();
    }

    /**
     * Maps a compiled class file name to its source file name.
     *
     * <p>Nested class files, such as {@code Outer$Inner.class}, map to the
     * source of their outermost class. Source file names map to themselves
     * and any other name is returned unchanged.</p>
     *
     * @param filename the file name, may be null
     * @return the source file name, or null if filename is null
     */
    public static String sourceNameOf(final String filename) {
        if (filename == null) {
            return null;
        }
        final int dot = extensionIndex(filename);
        if (dot < 0 || !BYTECODE_EXTENSION.equals(filename.substring(dot))) {
            return filename;
        }
        String base = filename.substring(0, dot);
        final int nameStart = lastSeparatorIndex(base) + 1;
        final int nested = base.indexOf('$', nameStart);
        if (nested > nameStart) {
            base = base.substring(0, nested);
        }
        return base + SOURCE_EXTENSION;
    }

    /**
     * Returns the position of the last directory separator in a name.
     *
     * <p>The forward slash always separates. The backslash only does on
     * platforms that use it as their separator.</p>
     *
     * @param name the name to inspect
     * @return the index of the last separator, or -1 if there is none
     */
    public static int lastSeparatorIndex(final String name) {
        int index = name.lastIndexOf('/');
        if (File.separatorChar != '/') {
            index = Math.max(index, name.lastIndexOf(File.separatorChar));
        }
        return index;
    }

    /**
     * Removes the last extension of a name, if it has one.
     *
     * @param name the name
     * @return the name without its last extension
     */
    static String stripExtension(final String name) {
        final int dot = extensionIndex(name);
        return dot < 0 ? name : name.substring(0, dot);
    }

    /**
     * Finds where the extension of the last path component starts.
     *
     * <p>Leading dots of a component do not start an extension, so
     * {@code .hidden} has none.</p>
     */
    private static int extensionIndex(final String name) {
        final int nameStart = lastSeparatorIndex(name) + 1;
        final int dot = name.lastIndexOf('.');
        if (dot <= nameStart) {
            return -1;
        }
        for (int i = nameStart; i < dot; i++) {
            if (name.charAt(i) != '.') {
                return dot;
            }
        }
        return -1;
    }

    private boolean exists(final String name) {
        if (name.isEmpty()) {
            return false;
        }
        try {
            return Files.exists(normalize(name));
        } catch (final InvalidPathException e) {
            LOG.debug("{} is not a valid path here: {}", name, e.getMessage());
            return false;
        }
    }

    private static Path against(final Path base, final String path) {
        final Path target = Paths.get(path);
        if (target.isAbsolute()) {
            return target.normalize();
        }
        return base.resolve(target).toAbsolutePath().normalize();
    }

}
