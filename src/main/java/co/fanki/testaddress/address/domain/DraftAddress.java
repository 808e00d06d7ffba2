package co.fanki.testaddress.address.domain;

import java.nio.file.Path;

/**
 * An address as parsed from a specifier, before any lookup filled it in.
 *
 * <p>The parts are not checked against each other: a module may be named
 * that does not exist, or a file may be named that maps to no module.</p>
 *
 * @param file the absolute path named by the specifier, or null
 * @param module the dotted name named by the specifier, or null
 * @param callable the callable after the colon, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DraftAddress(Path file, String module, String callable) {

    /** Returns true if the specifier named a path. */
    public boolean hasFile() {
        return file != null;
    }

    /** Returns true if the specifier named a dotted module. */
    public boolean hasModule() {
        return module != null;
    }

    /** Returns true if the specifier carried a callable. */
    public boolean hasCallable() {
        return callable != null;
    }

}
