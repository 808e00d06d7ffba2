package co.fanki.testaddress.address.application;

import co.fanki.testaddress.address.domain.Address;
import co.fanki.testaddress.address.domain.AddressResolver;
import co.fanki.testaddress.address.domain.DraftAddress;
import co.fanki.testaddress.module.domain.NameBinder;
import co.fanki.testaddress.module.domain.NameNotFoundException;
import co.fanki.testaddress.path.domain.PackageMapper;
import co.fanki.testaddress.path.domain.SourceRoots;
import co.fanki.testaddress.shared.Preconditions;
import co.fanki.testaddress.specifier.domain.MalformedSpecifierException;
import co.fanki.testaddress.specifier.domain.SpecifierParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns specifiers and runtime entities into canonical addresses.
 *
 * <p>A specifier goes through three steps: it is parsed into a draft, the
 * draft is completed from the file system, and the completed module and
 * callable are bound to a live entity whose address is then computed.</p>
 *
 * <p>A file named by the specifier always stays in the address, even when
 * the module's class comes from elsewhere. A file that maps to no module
 * keeps a file-only address, and a file whose derived module cannot be
 * loaded at all, such as a standalone source outside any package, keeps
 * its file, derived module and callable unbound.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class AddressService {

    private static final Logger LOG = LoggerFactory.getLogger(
            AddressService.class);

    private final SpecifierParser specifierParser;
    private final PackageMapper packageMapper;
    private final SourceRoots sourceRoots;
    private final NameBinder nameBinder;
    private final AddressResolver addressResolver;

    /**
     * Creates a new AddressService.
     *
     * @param theSpecifierParser parses raw specifiers
     * @param thePackageMapper maps between files and module names
     * @param theSourceRoots the roots module files are looked up under
     * @param theNameBinder binds dotted names to live entities
     * @param theAddressResolver computes addresses of live entities
     */
    public AddressService(
            final SpecifierParser theSpecifierParser,
            final PackageMapper thePackageMapper,
            final SourceRoots theSourceRoots,
            final NameBinder theNameBinder,
            final AddressResolver theAddressResolver) {
        this.specifierParser = Preconditions.requireNonNull(
                theSpecifierParser, "Specifier parser is required");
        this.packageMapper = Preconditions.requireNonNull(
                thePackageMapper, "Package mapper is required");
        this.sourceRoots = Preconditions.requireNonNull(
                theSourceRoots, "Source roots are required");
        this.nameBinder = Preconditions.requireNonNull(
                theNameBinder, "Name binder is required");
        this.addressResolver = Preconditions.requireNonNull(
                theAddressResolver, "Address resolver is required");
    }

    /**
     * Parses a specifier without looking anything up.
     *
     * @param specifier the raw specifier
     * @return the draft address
     */
    public DraftAddress draft(final String specifier) {
        return specifierParser.parse(specifier);
    }

    /**
     * Fills the missing file or module of a draft.
     *
     * <p>A named file must exist; its module is derived from the package
     * directories above it, if any. A named module gets the first source
     * file found under the source roots, if any.</p>
     *
     * @param draft the draft to complete
     * @return the completed draft
     * @throws co.fanki.testaddress.path.domain.PathNotFoundException if the
     *         draft names a file that does not exist
     */
    public DraftAddress complete(final DraftAddress draft) {
        Preconditions.requireNonNull(draft, "Draft address is required");

        if (draft.hasFile()) {
            final Path file = packageMapper.locator().requireFile(
                    draft.file().toString(), List.of());
            final String module = draft.hasModule()
                    ? draft.module()
                    : packageMapper.moduleNameFromPath(file.toString())
                            .orElse(null);
            return new DraftAddress(file, module, draft.callable());
        }

        if (draft.hasModule()) {
            final Path file = packageMapper.pathFromModuleName(
                    draft.module(), sourceRoots.roots()).orElse(null);
            return new DraftAddress(file, draft.module(), draft.callable());
        }

        return draft;
    }

    /**
     * Resolves a specifier into the address of the entity it names.
     *
     * @param specifier the raw specifier
     * @return the canonical address
     * @throws MalformedSpecifierException if the specifier cannot be parsed
     *         or names neither a file nor a module
     * @throws NameNotFoundException if the named module or callable does
     *         not exist, or if a module derived from a file is loadable but
     *         lacks the callable
     */
    public Address resolve(final String specifier) {
        LOG.info("Resolving specifier {}", specifier);

        final DraftAddress parsed = draft(specifier);
        final DraftAddress draft = complete(parsed);

        if (draft.hasModule()) {
            final String name = draft.hasCallable()
                    ? draft.module() + "." + draft.callable()
                    : draft.module();
            final Object entity;
            try {
                entity = nameBinder.bind(name);
            } catch (final NameNotFoundException e) {
                if (parsed.hasModule() || !isModuleMissing(draft, e)) {
                    throw e;
                }
                LOG.debug("{} is not loadable as {}, keeping the file",
                        draft.file(), draft.module());
                final String module = Preconditions.isDottedName(
                        draft.module()) ? draft.module() : null;
                return Address.of(draft.file(), module, draft.callable());
            }
            final Address resolved = addressResolver.resolve(entity);
            if (!parsed.hasFile()) {
                return resolved;
            }
            return Address.of(draft.file(), resolved.module(),
                    resolved.callable());
        }

        if (draft.hasFile()) {
            LOG.debug("{} is not inside a package, keeping the file",
                    draft.file());
            return Address.of(draft.file(), null, draft.callable());
        }

        throw new MalformedSpecifierException(specifier);
    }

    /** Checks if binding failed inside the module part of the name. */
    private static boolean isModuleMissing(final DraftAddress draft,
            final NameNotFoundException e) {
        final int moduleSegments = draft.module().split("\\.").length;
        return e.getPosition() < moduleSegments;
    }

    /**
     * Computes the address of a live entity.
     *
     * @param entity the entity
     * @return the canonical address
     */
    public Address resolveEntity(final Object entity) {
        return addressResolver.resolve(entity);
    }

}
