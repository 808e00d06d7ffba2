package co.fanki.testaddress.address.domain;

import co.fanki.testaddress.module.domain.BoundMethod;
import co.fanki.testaddress.module.domain.LoadedModule;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;

/**
 * The shapes of runtime entity an address can be computed for.
 *
 * <p>The declaration order is the check order: when an entity has more than
 * one shape, the first variant that matches wins.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SuppressWarnings("deprecation")
public enum EntityVariant {

    /** An {@link Addressable}; its own answer is used as is. */
    SELF_DESCRIBING {
        @Override
        boolean matches(final Object entity) {
            return entity instanceof Addressable;
        }

        @Override
        Address address(final Object entity, final AddressResolver resolver) {
            final Address address = ((Addressable) entity).address();
            if (address == null) {
                throw new UnresolvableEntityException(entity,
                        "its address() returned null");
            }
            return address;
        }
    },

    /** A {@link LoadedModule}: its file and name, no callable. */
    MODULE {
        @Override
        boolean matches(final Object entity) {
            return entity instanceof LoadedModule;
        }

        @Override
        Address address(final Object entity, final AddressResolver resolver) {
            final LoadedModule module = (LoadedModule) entity;
            return Address.of(module.file().orElse(null), module.name(), null);
        }
    },

    /**
     * A class, or a static method of a unit's top-level class; the callable
     * is the name relative to the unit.
     */
    FUNCTION_OR_CLASS {
        @Override
        boolean matches(final Object entity) {
            if (entity instanceof Class<?> type) {
                return !type.isArray() && !type.isPrimitive();
            }
            return entity instanceof Method method && isFunction(method);
        }

        @Override
        Address address(final Object entity, final AddressResolver resolver) {
            final Class<?> owner;
            final String callable;
            if (entity instanceof Class<?> type) {
                owner = type;
                callable = unitRelativeName(type);
            } else {
                final Method function = (Method) entity;
                owner = function.getDeclaringClass();
                callable = function.getName();
            }
            final LoadedModule module = resolver.moduleLoader()
                    .moduleOf(owner);
            return Address.of(module.file().orElse(null), module.name(),
                    callable);
        }
    },

    /**
     * An instance of an application class with no identity of its own; it is
     * addressed as its class.
     */
    INSTANCE {
        @Override
        boolean matches(final Object entity) {
            return !hasOwnShape(entity) && isUserDefined(entity.getClass());
        }

        @Override
        Address address(final Object entity, final AddressResolver resolver) {
            return resolver.resolve(entity.getClass());
        }
    },

    /**
     * A {@link BoundMethod} or any other method; addressed as
     * {@code <class callable>.<method name>} of the owning class.
     */
    BOUND_METHOD {
        @Override
        boolean matches(final Object entity) {
            return entity instanceof BoundMethod || entity instanceof Method;
        }

        @Override
        Address address(final Object entity, final AddressResolver resolver) {
            if (entity instanceof BoundMethod bound) {
                return qualify(resolver.resolve(bound.owner()), bound.name());
            }
            final Method method = (Method) entity;
            return qualify(resolver.resolve(method.getDeclaringClass()),
                    method.getName());
        }
    },

    /** A {@link FunctionTestCase}, addressed as the function it wraps. */
    FUNCTION_TEST_CASE {
        @Override
        boolean matches(final Object entity) {
            return entity instanceof FunctionTestCase;
        }

        @Override
        Address address(final Object entity, final AddressResolver resolver) {
            final Object function = ((FunctionTestCase) entity).testFunction();
            if (function == null) {
                throw new UnresolvableEntityException(entity,
                        "it wraps no test function");
            }
            return resolver.resolve(function,
                    EnumSet.complementOf(EnumSet.of(FUNCTION_TEST_CASE)));
        }
    },

    /**
     * A {@link NamedTestCase} or {@link LegacyNamedTestCase}; addressed as
     * {@code <class callable>.<test method name>}.
     */
    NAMED_TEST_CASE {
        @Override
        boolean matches(final Object entity) {
            return entity instanceof NamedTestCase
                    || entity instanceof LegacyNamedTestCase;
        }

        @Override
        Address address(final Object entity, final AddressResolver resolver) {
            final String methodName = entity instanceof NamedTestCase named
                    ? named.testMethodName()
                    : ((LegacyNamedTestCase) entity).getName();
            if (methodName == null || methodName.isBlank()) {
                throw new UnresolvableEntityException(entity,
                        "it names no test method");
            }
            return qualify(resolver.resolve(entity.getClass()), methodName);
        }
    };

    /**
     * Checks if the entity has this shape.
     *
     * @param entity the entity, never null
     * @return true if this variant applies
     */
    abstract boolean matches(Object entity);

    /**
     * Computes the address of an entity of this shape.
     *
     * @param entity the entity, never null
     * @param resolver the resolver, for entities addressed through another
     * @return the address
     */
    abstract Address address(Object entity, AddressResolver resolver);

    private static boolean isFunction(final Method method) {
        return Modifier.isStatic(method.getModifiers())
                && method.getDeclaringClass().getEnclosingClass() == null;
    }

    private static boolean hasOwnShape(final Object entity) {
        return entity instanceof Addressable
                || entity instanceof LoadedModule
                || entity instanceof Class
                || entity instanceof Method
                || entity instanceof BoundMethod
                || entity instanceof FunctionTestCase
                || entity instanceof NamedTestCase
                || entity instanceof LegacyNamedTestCase;
    }

    private static boolean isUserDefined(final Class<?> type) {
        final ClassLoader loader = type.getClassLoader();
        return loader != null
                && loader != ClassLoader.getPlatformClassLoader()
                && !type.isArray()
                && !type.isSynthetic()
                && !type.isHidden();
    }

    private static Address qualify(final Address owner, final String name) {
        final String callable = owner.callable() == null
                ? name
                : owner.callable() + "." + name;
        return owner.withCallable(callable);
    }

    /**
     * Names a class relative to its compilation unit, {@code Outer.Inner}
     * for member classes. Local and anonymous classes cannot be reached by
     * name, so they keep their binary name, {@code Outer$1}.
     */
    private static String unitRelativeName(final Class<?> type) {
        final Deque<String> names = new ArrayDeque<>();
        for (Class<?> current = type; current != null;
                current = current.getEnclosingClass()) {
            if (current.isAnonymousClass() || current.isLocalClass()
                    || current.isHidden()) {
                final String packageName = type.getPackageName();
                return packageName.isEmpty()
                        ? type.getName()
                        : type.getName().substring(packageName.length() + 1);
            }
            names.addFirst(current.getSimpleName());
        }
        return String.join(".", names);
    }

}
