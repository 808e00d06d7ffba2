package co.fanki.testaddress.module.domain;

import co.fanki.testaddress.shared.Preconditions;

import java.lang.reflect.Method;

/**
 * A method together with the object it is called on.
 *
 * <p>The owner is the receiver's class, not the declaring class, so a test
 * method inherited from a base class is owned by the concrete test.</p>
 *
 * @param receiver the object the method is bound to
 * @param method the method
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BoundMethod(Object receiver, Method method) {

    /**
     * Validates the binding.
     *
     * @param receiver the object the method is bound to
     * @param method the method
     */
    public BoundMethod {
        Preconditions.requireNonNull(receiver, "Receiver is required");
        Preconditions.requireNonNull(method, "Method is required");
        Preconditions.require(
                method.getDeclaringClass().isInstance(receiver),
                method + " cannot be bound to " + receiver.getClass());
    }

    /** Returns the class the method is bound through. */
    public Class<?> owner() {
        return receiver.getClass();
    }

    /** Returns the method name. */
    public String name() {
        return method.getName();
    }

}
