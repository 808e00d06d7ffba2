package co.fanki.testaddress.module.domain;

import co.fanki.testaddress.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Binds a dotted name to the live entity it names.
 *
 * <p>The longest prefix of the name that can be imported as a module is
 * imported first, dropping one trailing segment per failed attempt. The
 * remaining segments are then looked up one by one:</p>
 * <ul>
 *   <li>on a package, as a unit or subpackage below it</li>
 *   <li>on a unit, as its top-level class, then as a member of that
 *       class</li>
 *   <li>on a class, as a member class, then as a method</li>
 * </ul>
 *
 * <p>A method has no members, so a segment after one is never found.</p>
 *
 * <p>So {@code com.acme.FooTest.Nested.testSave} imports
 * {@code com.acme.FooTest} and walks {@code Nested} then
 * {@code testSave}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NameBinder {

    private static final Logger LOG = LoggerFactory.getLogger(
            NameBinder.class);

    private final ModuleLoader moduleLoader;

    /**
     * Creates a binder.
     *
     * @param theModuleLoader the loader modules are imported with
     */
    public NameBinder(final ModuleLoader theModuleLoader) {
        this.moduleLoader = Preconditions.requireNonNull(theModuleLoader,
                "Module loader is required");
    }

    /**
     * Binds a dotted name.
     *
     * @param dottedName the name, e.g. {@code com.acme.FooTest.testSave}
     * @return the module, class or method it names
     * @throws NameNotFoundException if no prefix can be imported or a
     *         remaining segment does not exist
     */
    public Object bind(final String dottedName) {
        Preconditions.requireNonBlank(dottedName, "Name is required");
        if (!Preconditions.isDottedName(dottedName)) {
            throw new NameNotFoundException(dottedName, dottedName, null);
        }

        final List<String> parts = Arrays.asList(dottedName.split("\\."));

        LoadedModule module = null;
        ModuleImportException lastFailure = null;
        int imported = parts.size();
        while (imported > 0) {
            final String candidate = String.join(".",
                    parts.subList(0, imported));
            try {
                module = moduleLoader.importModule(candidate);
                break;
            } catch (final ModuleImportException e) {
                LOG.debug("Cannot import {}: {}", candidate, e.getMessage());
                lastFailure = e;
                imported--;
            }
        }
        if (module == null) {
            throw new NameNotFoundException(dottedName, parts.get(0),
                    lastFailure);
        }

        LOG.debug("Resolving {} from {}", parts.subList(imported,
                parts.size()), module);

        Object current = module;
        for (int i = imported; i < parts.size(); i++) {
            final String segment = parts.get(i);
            final int position = i;
            current = attribute(current, segment).orElseThrow(
                    () -> new NameNotFoundException(dottedName, segment,
                            position, null));
        }
        return current;
    }

    private Optional<Object> attribute(final Object owner,
            final String segment) {
        if (owner instanceof LoadedModule module) {
            return moduleAttribute(module, segment);
        }
        if (owner instanceof Class<?> type) {
            return classAttribute(type, segment);
        }
        return Optional.empty();
    }

    private Optional<Object> moduleAttribute(final LoadedModule module,
            final String segment) {
        final Optional<Class<?>> unitClass = module.unitClass();
        if (unitClass.isEmpty()) {
            final String child = module.name() + "." + segment;
            try {
                return Optional.of(moduleLoader.importModule(child));
            } catch (final ModuleImportException e) {
                LOG.debug("{} has no {}: {}", module, segment, e.getMessage());
                return Optional.empty();
            }
        }
        if (unitClass.get().getSimpleName().equals(segment)) {
            return Optional.of(unitClass.get());
        }
        return classAttribute(unitClass.get(), segment);
    }

    private static Optional<Object> classAttribute(final Class<?> type,
            final String segment) {
        final Optional<Class<?>> nested = Members.nestedClass(type, segment);
        if (nested.isPresent()) {
            return Optional.of(nested.get());
        }
        final List<Method> methods = Members.methods(type, segment);
        if (methods.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(methods.get(0));
    }

}
