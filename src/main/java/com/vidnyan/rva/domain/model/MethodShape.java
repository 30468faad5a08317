package com.vidnyan.rva.domain.model;

import java.util.List;

/**
 * Signature facts about a declared method, enough to judge equality methods.
 */
public record MethodShape(
    String name,
    List<Parameter> parameters,
    boolean isStatic,
    boolean isAbstract,
    boolean overridesBase,
    String declaringType
) {

    public MethodShape {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * A parameter type. {@code nullableWrapped} marks a parameter such as
     * {@code Optional<T>}, in which case {@code typeName} is the wrapped type.
     */
    public record Parameter(String typeName, boolean nullableWrapped) {

        public static Parameter of(String typeName) {
            return new Parameter(typeName, false);
        }

        public static Parameter wrapped(String typeName) {
            return new Parameter(typeName, true);
        }
    }

    /**
     * An {@code equals(T)} overload declared on {@code declaringType}.
     */
    public static MethodShape valueEquals(String declaringType) {
        return new MethodShape("equals", List.of(Parameter.of(declaringType)),
                false, false, false, declaringType);
    }

    /**
     * An {@code equals(Object)} override declared on {@code declaringType}.
     */
    public static MethodShape identityEqualsOverride(String declaringType, String universalBase) {
        return new MethodShape("equals", List.of(Parameter.of(universalBase)),
                false, false, true, declaringType);
    }

    public boolean hasSingleParameter() {
        return parameters.size() == 1;
    }
}
