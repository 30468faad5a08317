package com.vidnyan.rva.domain.model;

/**
 * Declaration category of a type as reported by the host.
 */
public enum TypeCategory {
    PRIMITIVE,
    ENUM,
    /** Untyped placeholder such as a dynamic type. */
    UNTYPED,
    ARRAY,
    CLASS,
    INTERFACE,
    RECORD,
    /** Value type whose equality compares its fields. */
    STRUCT,
    TUPLE,
    TYPE_PARAMETER,
    OTHER
}
