package co.fanki.testaddress.module.domain;

import co.fanki.testaddress.shared.Preconditions;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A module made available by a {@link ModuleLoader}.
 *
 * <p>A module is either a compilation unit, named after its top-level class
 * ({@code com.acme.FooTest}), or a package ({@code com.acme}). Loaders keep
 * one instance per name, so modules are compared by identity.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LoadedModule {

    private final String name;
    private final Path file;
    private final Class<?> unitClass;

    private LoadedModule(final String theName, final Path theFile,
            final Class<?> theUnitClass) {
        this.name = Preconditions.requireDottedName(theName,
                "Module name must be a dotted name");
        this.file = theFile == null ? null
                : theFile.toAbsolutePath().normalize();
        this.unitClass = theUnitClass;
    }

    /**
     * Creates the module of a compilation unit.
     *
     * @param name the dotted name of the unit, the top-level class name
     * @param unitClass the top-level class of the unit
     * @param file the source file of the unit, may be null
     * @return the module
     */
    public static LoadedModule unit(final String name,
            final Class<?> unitClass, final Path file) {
        Preconditions.requireNonNull(unitClass, "Unit class is required");
        Preconditions.require(unitClass.getEnclosingClass() == null,
                "Unit class must be a top-level class: " + unitClass);
        return new LoadedModule(name, file, unitClass);
    }

    /**
     * Creates the module of a package.
     *
     * @param name the dotted package name
     * @param file the package marker file, may be null
     * @return the module
     */
    public static LoadedModule pkg(final String name, final Path file) {
        return new LoadedModule(name, file, null);
    }

    /** Returns the dotted module name. */
    public String name() {
        return name;
    }

    /** Returns the last segment of the module name. */
    public String simpleName() {
        return name.substring(name.lastIndexOf('.') + 1);
    }

    /** Returns the absolute source file of this module, if known. */
    public Optional<Path> file() {
        return Optional.ofNullable(file);
    }

    /** Returns true if this module is a package rather than a unit. */
    public boolean isPackage() {
        return unitClass == null;
    }

    /** Returns the top-level class of a unit; empty for packages. */
    public Optional<Class<?>> unitClass() {
        return Optional.ofNullable(unitClass);
    }

    @Override
    public String toString() {
        return "<module '" + name + "' from '" + file + "'>";
    }

}
