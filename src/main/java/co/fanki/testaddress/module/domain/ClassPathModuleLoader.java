package co.fanki.testaddress.module.domain;

import co.fanki.testaddress.path.domain.PackageMapper;
import co.fanki.testaddress.path.domain.SourceRoots;
import co.fanki.testaddress.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Imports modules from a class loader, taking their source files from a set
 * of source roots.
 *
 * <p>A dotted name is imported as the compilation unit of the top-level
 * class with that name when the class loader knows one, and as a package
 * otherwise. Classes are loaded without being initialized. Imported modules
 * are kept in a concurrent registry, so importing a name twice returns the
 * same module.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ClassPathModuleLoader implements ModuleLoader {

    private static final Logger LOG = LoggerFactory.getLogger(
            ClassPathModuleLoader.class);

    private final ClassLoader classLoader;
    private final PackageMapper packageMapper;
    private final SourceRoots sourceRoots;

    private final Map<String, LoadedModule> registry =
            new ConcurrentHashMap<>();

    /**
     * Creates a loader.
     *
     * @param theClassLoader the class loader units are loaded from
     * @param thePackageMapper the mapper used to find source files
     * @param theSourceRoots the roots source files are looked up under
     */
    public ClassPathModuleLoader(final ClassLoader theClassLoader,
            final PackageMapper thePackageMapper,
            final SourceRoots theSourceRoots) {
        this.classLoader = Preconditions.requireNonNull(theClassLoader,
                "Class loader is required");
        this.packageMapper = Preconditions.requireNonNull(thePackageMapper,
                "Package mapper is required");
        this.sourceRoots = Preconditions.requireNonNull(theSourceRoots,
                "Source roots are required");
    }

    /** {@inheritDoc} */
    @Override
    public LoadedModule importModule(final String dottedName) {
        if (!Preconditions.isDottedName(dottedName)) {
            throw new ModuleImportException(String.valueOf(dottedName), null);
        }
        return registry.computeIfAbsent(dottedName, this::load);
    }

    /** {@inheritDoc} */
    @Override
    public Optional<LoadedModule> lookup(final String dottedName) {
        if (dottedName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registry.get(dottedName));
    }

    /** {@inheritDoc} */
    @Override
    public LoadedModule moduleOf(final Class<?> type) {
        Preconditions.requireNonNull(type, "Type is required");
        Preconditions.require(!type.isArray() && !type.isPrimitive(),
                "Arrays and primitives have no module: " + type);

        Class<?> unit = type;
        while (unit.getEnclosingClass() != null) {
            unit = unit.getEnclosingClass();
        }
        final Class<?> unitClass = unit;
        return registry.computeIfAbsent(unitClass.getName(),
                name -> LoadedModule.unit(name, unitClass, sourceFile(name)));
    }

    private LoadedModule load(final String dottedName) {
        LOG.debug("Importing {}", dottedName);

        Throwable classFailure;
        try {
            final Class<?> type = Class.forName(dottedName, false, classLoader);
            if (type.getEnclosingClass() == null) {
                return LoadedModule.unit(dottedName, type,
                        sourceFile(dottedName));
            }
            classFailure = null;
        } catch (final ClassNotFoundException | LinkageError e) {
            classFailure = e;
        }

        if (isPackage(dottedName)) {
            return LoadedModule.pkg(dottedName, sourceFile(dottedName));
        }

        throw new ModuleImportException(dottedName, classFailure);
    }

    private boolean isPackage(final String dottedName) {
        final Optional<Path> marker = packageMapper.pathFromModuleName(
                dottedName, sourceRoots.roots());
        if (marker.isPresent() && marker.get().getFileName().toString()
                .equals(PackageMapper.PACKAGE_MARKER)) {
            return true;
        }
        return classLoader.getDefinedPackage(dottedName) != null
                || classLoader.getResource(dottedName.replace('.', '/'))
                        != null;
    }

    private Path sourceFile(final String dottedName) {
        return packageMapper.pathFromModuleName(dottedName,
                sourceRoots.roots()).orElse(null);
    }

}
