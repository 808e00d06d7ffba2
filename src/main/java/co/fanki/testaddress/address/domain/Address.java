package co.fanki.testaddress.address.domain;

import co.fanki.testaddress.shared.Preconditions;
import co.fanki.testaddress.shared.ValueObject;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * The canonical identity of a test: source file, dotted module and dotted
 * callable.
 *
 * <p>Any of the three parts may be missing, but never all of them. The file,
 * when present, is absolute and normalized. The module, when present, is a
 * dotted sequence of identifiers. The callable is relative to the module,
 * such as {@code staticCheck} for a static method of the unit's top-level
 * class or {@code FooTest.testSave} for a test method.</p>
 *
 * <p>Addresses are the join key of the tool: reports, reruns and
 * deduplication all compare them with {@link #equals(Object)}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Address implements ValueObject {

    private static final long serialVersionUID = 1L;

    private final String file;
    private final String module;
    private final String callable;

    private Address(final String theFile, final String theModule,
            final String theCallable) {
        Preconditions.require(theFile != null || theModule != null
                        || theCallable != null,
                "An address needs a file, a module or a callable");
        if (theFile != null) {
            final Path path = Paths.get(theFile);
            Preconditions.require(path.isAbsolute()
                            && path.normalize().toString().equals(theFile),
                    "Address file must be absolute and normalized: "
                            + theFile);
        }
        if (theModule != null) {
            Preconditions.requireDottedName(theModule,
                    "Address module must be a dotted name");
        }
        if (theCallable != null) {
            Preconditions.requireNonBlank(theCallable,
                    "Address callable cannot be blank");
        }
        this.file = theFile;
        this.module = theModule;
        this.callable = theCallable;
    }

    /**
     * Creates an address.
     *
     * @param file the absolute source file, may be null
     * @param module the dotted module name, may be null
     * @param callable the dotted callable name, may be null
     * @return the address
     * @throws IllegalArgumentException if all parts are missing or a part is
     *         not well formed
     */
    public static Address of(final Path file, final String module,
            final String callable) {
        return new Address(
                file == null ? null : file.toAbsolutePath().normalize()
                        .toString(),
                module,
                callable);
    }

    /**
     * Returns a copy of this address with another callable.
     *
     * @param theCallable the new callable, may be null
     * @return the new address
     */
    public Address withCallable(final String theCallable) {
        return new Address(file, module, theCallable);
    }

    /**
     * Renders this address back as a {@code location[:callable]} specifier.
     *
     * <p>The module is preferred as the location, the file is used when the
     * address has no module.</p>
     *
     * @return the specifier
     */
    public String toSpecifier() {
        final StringBuilder specifier = new StringBuilder();
        if (module != null) {
            specifier.append(module);
        } else if (file != null) {
            specifier.append(file);
        }
        if (callable != null) {
            specifier.append(':').append(callable);
        }
        return specifier.toString();
    }

    /** Returns the absolute source file, or null. */
    public String file() {
        return file;
    }

    /** Returns the dotted module name, or null. */
    public String module() {
        return module;
    }

    /** Returns the dotted callable name, or null. */
    public String callable() {
        return callable;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Address that = (Address) obj;
        return Objects.equals(file, that.file)
                && Objects.equals(module, that.module)
                && Objects.equals(callable, that.callable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, module, callable);
    }

    @Override
    public String toString() {
        return "(" + file + ", " + module + ", " + callable + ")";
    }

}
