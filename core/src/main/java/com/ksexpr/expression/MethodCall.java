package com.ksexpr.expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Method invocation on a value.
 *
 * <p>Example:
 * <pre>
 *   (str_0_to_4 + '56789').substring(2, 7)
 * </pre>
 */
public final class MethodCall implements Expression {

    private final Expression value;
    private final String methodName;
    private final List<Expression> arguments;

    /**
     * Creates a method call.
     *
     * @param value the receiver
     * @param methodName the method identifier
     * @param arguments the arguments, in call order (may be empty)
     */
    public MethodCall(Expression value, String methodName, List<? extends Expression> arguments) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.methodName = Objects.requireNonNull(methodName, "methodName must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        for (Expression arg : arguments) {
            Objects.requireNonNull(arg, "arguments must not contain null");
        }
        this.arguments = new ArrayList<>(arguments);
    }

    public Expression value() {
        return value;
    }

    public String methodName() {
        return methodName;
    }

    /**
     * Returns the call arguments.
     *
     * @return an unmodifiable list of argument expressions
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public String toKsy() {
        String argsKsy = arguments.stream()
            .map(Expression::toKsy)
            .collect(Collectors.joining(", "));
        return value.toKsy() + "." + methodName + "(" + argsKsy + ")";
    }

    @Override
    public String toString() {
        return "MethodCall(" + value + "." + methodName + arguments + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MethodCall)) return false;
        MethodCall that = (MethodCall) obj;
        return value.equals(that.value) &&
               methodName.equals(that.methodName) &&
               arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, methodName, arguments);
    }

    public static MethodCall of(Expression value, String methodName, Expression... arguments) {
        return new MethodCall(value, methodName, Arrays.asList(arguments));
    }
}
