package com.vidnyan.rva.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Handle to a type in the host type system.
 * Implemented by adapters that have access to type information.
 * Every method must be side-effect free for the duration of one analysis.
 */
public interface TypeRef {

    /**
     * Key used to detect revisits. Two handles to the same host type
     * must return equal identities.
     */
    Object identity();

    /**
     * Human readable name, e.g. {@code java.util.List<java.lang.String>}.
     */
    String displayName();

    /**
     * Raw type information used to derive kind and equality capabilities.
     */
    TypeShape shape();

    /**
     * True for wrappers such as {@code Optional<T>} whose equality delegates to the wrapped value.
     */
    boolean isNullableValueWrapper();

    /**
     * The wrapped type of a nullable value wrapper, if it can be determined.
     */
    Optional<TypeRef> unwrap();

    /**
     * Declared instance fields/properties, in declaration order.
     */
    List<Member> members();

    /**
     * Tuple elements, in order. Empty for anything that is not a tuple.
     */
    List<Member> tupleElements();
}
