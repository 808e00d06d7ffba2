package co.fanki.testaddress.module.domain;

import co.fanki.testaddress.shared.DomainException;

/**
 * Thrown by a {@link ModuleLoader} when a dotted name names no module.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ModuleImportException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this failure. */
    public static final String CODE = "MODULE_IMPORT_FAILED";

    /**
     * Creates the exception.
     *
     * @param moduleName the name that could not be imported
     * @param cause the underlying failure, may be null
     */
    public ModuleImportException(final String moduleName,
            final Throwable cause) {
        super("No module named " + moduleName, CODE, cause);
    }

}
