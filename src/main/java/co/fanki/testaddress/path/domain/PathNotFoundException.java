package co.fanki.testaddress.path.domain;

import co.fanki.testaddress.shared.DomainException;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when a file or directory cannot be found under any search base.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PathNotFoundException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this failure. */
    public static final String CODE = "PATH_NOT_FOUND";

    private final String path;

    /**
     * Creates the exception.
     *
     * @param thePath the path that was looked up
     * @param bases the directories it was looked up in
     */
    public PathNotFoundException(final String thePath,
            final List<Path> bases) {
        super("Path '" + thePath + "' not found in " + bases, CODE);
        this.path = thePath;
    }

    /**
     * Returns the path that could not be found.
     *
     * @return the path as given by the caller
     */
    public String getPath() {
        return path;
    }

}
