package co.fanki.testaddress.address.domain;

import co.fanki.testaddress.module.domain.ModuleLoader;
import co.fanki.testaddress.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Computes the canonical {@link Address} of a runtime entity.
 *
 * <p>The entity is matched against the {@link EntityVariant}s in their
 * declaration order and the first match computes the address. Entities of
 * no known shape are rejected; a partial address is never returned.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AddressResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            AddressResolver.class);

    private final ModuleLoader moduleLoader;

    /**
     * Creates a resolver.
     *
     * @param theModuleLoader the loader used to find the module of a class
     */
    public AddressResolver(final ModuleLoader theModuleLoader) {
        this.moduleLoader = Preconditions.requireNonNull(theModuleLoader,
                "Module loader is required");
    }

    /**
     * Computes the address of an entity.
     *
     * @param entity the module, class, method, test case or other object
     * @return the address, never null
     * @throws UnresolvableEntityException if the entity has no known shape
     */
    public Address resolve(final Object entity) {
        return resolve(entity, EnumSet.allOf(EntityVariant.class));
    }

    /**
     * Computes the address of an entity, considering only some variants.
     *
     * @param entity the entity
     * @param variants the variants to consider, checked in declaration order
     * @return the address, never null
     */
    Address resolve(final Object entity, final Set<EntityVariant> variants) {
        if (entity == null) {
            throw new UnresolvableEntityException(null);
        }
        for (final EntityVariant variant : EntityVariant.values()) {
            if (variants.contains(variant) && variant.matches(entity)) {
                final Address address = variant.address(entity, this);
                LOG.debug("{} resolved as {} to {}", entity, variant, address);
                return address;
            }
        }
        LOG.warn("No address for entity of type {}",
                entity.getClass().getName());
        throw new UnresolvableEntityException(entity);
    }

    /** Returns the loader classes are mapped to modules with. */
    ModuleLoader moduleLoader() {
        return moduleLoader;
    }

}
