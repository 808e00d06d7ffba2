package co.fanki.testaddress.address.domain;

import co.fanki.testaddress.shared.DomainException;

/**
 * Thrown when an entity has none of the shapes an address can be computed
 * for.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class UnresolvableEntityException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this failure. */
    public static final String CODE = "UNRESOLVABLE_ENTITY";

    private final String entityType;

    /**
     * Creates the exception for an entity.
     *
     * @param entity the entity, may be null
     */
    public UnresolvableEntityException(final Object entity) {
        this(entity, "unknown entity shape");
    }

    /**
     * Creates the exception for an entity with a reason.
     *
     * @param entity the entity, may be null
     * @param reason why the entity cannot be resolved
     */
    public UnresolvableEntityException(final Object entity,
            final String reason) {
        super("Cannot compute an address for " + entity + " ("
                + typeOf(entity) + "): " + reason, CODE);
        this.entityType = typeOf(entity);
    }

    /**
     * Returns the runtime type name of the entity.
     *
     * @return the type name, {@code "null"} for a null entity
     */
    public String getEntityType() {
        return entityType;
    }

    private static String typeOf(final Object entity) {
        return entity == null ? "null" : entity.getClass().getName();
    }

}
