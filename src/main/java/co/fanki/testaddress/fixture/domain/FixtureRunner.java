package co.fanki.testaddress.fixture.domain;

import co.fanki.testaddress.module.domain.LoadedModule;
import co.fanki.testaddress.module.domain.Members;
import co.fanki.testaddress.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Optional;

/**
 * Runs the first fixture found on an object among candidate names.
 *
 * <p>Used for setup and teardown of modules, classes and test objects,
 * where several spellings of the same fixture are accepted, for example
 * {@code setUp}, {@code setup} and {@code beforeEach}. Fixtures are optional:
 * when no candidate exists nothing runs.</p>
 *
 * <p>How a fixture is called depends on what it was found on:</p>
 * <ul>
 *   <li>a unit module: a static method of its top-level class; if it takes
 *       one parameter that accepts a {@link LoadedModule}, it receives the
 *       module, otherwise it takes no arguments</li>
 *   <li>a class: a static method taking no arguments</li>
 *   <li>any other object: a method taking no arguments, called on the
 *       object</li>
 * </ul>
 *
 * <p>Package modules carry no fixtures.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FixtureRunner {

    private static final Logger LOG = LoggerFactory.getLogger(
            FixtureRunner.class);

    /**
     * Runs the first fixture present on the target.
     *
     * @param target the module, class or object to run the fixture on
     * @param names the candidate fixture names, in order of preference
     * @return what the fixture returned, empty if it returned nothing or no
     *         candidate was present
     * @throws FixtureNotCallableException if a candidate is present but is not
     *         a method following the fixture convention
     * @throws FixtureFailedException if the fixture threw a checked exception
     */
    public Optional<Object> tryRun(final Object target,
            final List<String> names) {
        Preconditions.requireNonNull(target, "Fixture target is required");
        Preconditions.requireNonNull(names, "Fixture names are required");

        for (final String name : names) {
            final Optional<Invocation> fixture = find(target, name);
            if (fixture.isPresent()) {
                return Optional.ofNullable(invoke(fixture.get(), target, name));
            }
        }
        return Optional.empty();
    }

    private Optional<Invocation> find(final Object target, final String name) {
        if (target instanceof LoadedModule module) {
            final Optional<Class<?>> unitClass = module.unitClass();
            if (unitClass.isEmpty()) {
                return Optional.empty();
            }
            return findModuleFixture(module, unitClass.get(), name);
        }
        if (target instanceof Class<?> type) {
            return findNoArgFixture(type, null, name);
        }
        return findNoArgFixture(target.getClass(), target, name);
    }

    private Optional<Invocation> findModuleFixture(final LoadedModule module,
            final Class<?> unitClass, final String name) {
        final List<Method> methods = Members.methods(unitClass, name);
        if (methods.isEmpty()) {
            return absent(unitClass, module, name);
        }

        Method noArg = null;
        for (final Method method : methods) {
            if (!Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            if (method.getParameterCount() == 1
                    && method.getParameterTypes()[0]
                            .isAssignableFrom(LoadedModule.class)) {
                return Optional.of(new Invocation(method, null, module));
            }
            if (method.getParameterCount() == 0 && noArg == null) {
                noArg = method;
            }
        }
        if (noArg != null) {
            return Optional.of(new Invocation(noArg, null));
        }
        throw new FixtureNotCallableException(name, module, null);
    }

    /**
     * Finds a fixture taking no arguments. A null receiver means only
     * static methods qualify.
     */
    private Optional<Invocation> findNoArgFixture(final Class<?> type,
            final Object receiver, final String name) {
        final List<Method> methods = Members.methods(type, name);
        if (methods.isEmpty()) {
            return absent(type, receiver == null ? type : receiver, name);
        }
        for (final Method method : methods) {
            final boolean isStatic = Modifier.isStatic(method.getModifiers());
            if (method.getParameterCount() == 0
                    && (isStatic || receiver != null)) {
                return Optional.of(new Invocation(method,
                        isStatic ? null : receiver));
            }
        }
        throw new FixtureNotCallableException(name,
                receiver == null ? type : receiver, null);
    }

    private static Optional<Invocation> absent(final Class<?> type,
            final Object target, final String name) {
        if (Members.hasField(type, name)) {
            throw new FixtureNotCallableException(name, target, null);
        }
        return Optional.empty();
    }

    private Object invoke(final Invocation fixture, final Object target,
            final String name) {
        final Method method = fixture.method();
        LOG.debug("call fixture {}.{}({})", target, name,
                fixture.arguments().length == 0 ? "" : target);
        if (!method.trySetAccessible()) {
            LOG.debug("Cannot make {} accessible", method);
        }
        try {
            return method.invoke(fixture.receiver(), fixture.arguments());
        } catch (final IllegalAccessException e) {
            throw new FixtureNotCallableException(name, target, e);
        } catch (final InvocationTargetException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new FixtureFailedException(name, target, cause);
        }
    }

    /** A fixture method ready to be called. */
    private record Invocation(Method method, Object receiver,
            Object... arguments) {
    }

}
