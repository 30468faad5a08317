package com.vidnyan.rva.domain.semantics;

/**
 * Equality-relevant kind of a type, computed once per visit by {@link KindResolver}.
 */
public enum Kind {
    PRIMITIVE,
    ENUM_LIKE,
    UNTYPED_OR_UNIVERSAL_BASE,
    FIXED_SIZE_BUFFER_OVERLAY,
    KNOWN_NON_VALUE_WRAPPER,
    HETEROGENEOUS_FIXED_TUPLE,
    DERIVED_EQUALITY_COMPOSITE,
    REFERENCE_COMPOSITE,
    VALUE_COMPOSITE,
    TYPE_PARAMETER_OR_OTHER
}
