package co.fanki.testaddress.module.domain;

import java.util.Optional;

/**
 * Imports modules by dotted name and remembers the ones already imported.
 *
 * <p>Importing the same name twice must return the same module. Beyond
 * that, nothing is assumed about how modules are cached. Implementations
 * used from several threads must be thread safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ModuleLoader {

    /**
     * Imports a module.
     *
     * @param dottedName the module name
     * @return the module, never null
     * @throws ModuleImportException if no unit or package has that name
     */
    LoadedModule importModule(String dottedName);

    /**
     * Returns a module that has already been imported.
     *
     * @param dottedName the module name
     * @return the module, or empty if it was never imported
     */
    Optional<LoadedModule> lookup(String dottedName);

    /**
     * Returns the module of the unit that declares a class.
     *
     * <p>The class is already loaded, so this never fails for a class of a
     * real compilation unit.</p>
     *
     * @param type the class, top-level or nested
     * @return the module of its outermost class
     */
    LoadedModule moduleOf(Class<?> type);

}
