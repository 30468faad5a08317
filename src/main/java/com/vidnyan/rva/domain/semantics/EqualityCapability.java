package com.vidnyan.rva.domain.semantics;

/**
 * Equality methods a type declares directly.
 *
 * @param hasOwnValueEqualsMethod      an {@code equals(T)} overload taking the type itself
 * @param hasOwnIdentityEqualsOverride an {@code equals(Object)} override
 */
public record EqualityCapability(
    boolean hasOwnValueEqualsMethod,
    boolean hasOwnIdentityEqualsOverride
) {

    public static final EqualityCapability NONE = new EqualityCapability(false, false);

    public boolean any() {
        return hasOwnValueEqualsMethod || hasOwnIdentityEqualsOverride;
    }
}
