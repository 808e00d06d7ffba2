package co.fanki.testaddress.module.domain;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up members of a class by name, including inherited ones.
 *
 * <p>Members declared closer to the given class shadow the ones of its
 * superclasses. Synthetic and bridge methods are never returned.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Members {

    private Members() {
    }

    /**
     * Finds a member class by simple name.
     *
     * @param owner the class to search
     * @param simpleName the simple name of the member class
     * @return the member class, or empty
     */
    public static Optional<Class<?>> nestedClass(final Class<?> owner,
            final String simpleName) {
        for (Class<?> type = owner; type != null; type = type.getSuperclass()) {
            for (final Class<?> nested : type.getDeclaredClasses()) {
                if (nested.getSimpleName().equals(simpleName)) {
                    return Optional.of(nested);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the methods with a name, fewest parameters first.
     *
     * @param owner the class to search
     * @param name the method name
     * @return the matching methods, never null
     */
    public static List<Method> methods(final Class<?> owner,
            final String name) {
        final Map<String, Method> bySignature = new LinkedHashMap<>();
        for (Class<?> type = owner; type != null; type = type.getSuperclass()) {
            for (final Method method : type.getDeclaredMethods()) {
                collect(bySignature, method, name);
            }
        }
        for (final Method method : owner.getMethods()) {
            collect(bySignature, method, name);
        }
        final List<Method> result = new ArrayList<>(bySignature.values());
        result.sort(Comparator.comparingInt(Method::getParameterCount));
        return result;
    }

    /**
     * Checks if a class declares or inherits a field with a name.
     *
     * @param owner the class to search
     * @param name the field name
     * @return true if the field exists
     */
    public static boolean hasField(final Class<?> owner, final String name) {
        for (Class<?> type = owner; type != null; type = type.getSuperclass()) {
            for (final Field field : type.getDeclaredFields()) {
                if (field.getName().equals(name)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void collect(final Map<String, Method> bySignature,
            final Method method, final String name) {
        if (!method.getName().equals(name)
                || method.isSynthetic() || method.isBridge()) {
            return;
        }
        bySignature.putIfAbsent(
                Arrays.toString(method.getParameterTypes()), method);
    }

}
