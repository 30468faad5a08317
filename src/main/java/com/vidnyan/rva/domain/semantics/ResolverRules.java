package com.vidnyan.rva.domain.semantics;

import java.util.Set;

/**
 * Name tables consulted by {@link KindResolver}.
 * Immutable value object.
 */
public record ResolverRules(
    String universalBaseType,
    Set<String> valueLikeTypes,
    Set<String> knownNonValueWrappers,
    Set<String> derivedEqualityAnnotations,
    Set<String> bufferOverlayAnnotations
) {

    public static final Set<String> DEFAULT_VALUE_LIKE_TYPES = Set.of(
            "java.lang.String",
            "java.lang.Boolean",
            "java.lang.Byte",
            "java.lang.Short",
            "java.lang.Character",
            "java.lang.Integer",
            "java.lang.Long",
            "java.lang.Float",
            "java.lang.Double"
    );

    public static final Set<String> DEFAULT_KNOWN_NON_VALUE_WRAPPERS = Set.of(
            "java.lang.StringBuilder",
            "java.lang.StringBuffer",
            "java.util.concurrent.atomic.AtomicIntegerArray",
            "java.util.concurrent.atomic.AtomicLongArray",
            "java.util.concurrent.atomic.AtomicReferenceArray",
            "java.lang.foreign.MemorySegment",
            "jdk.incubator.foreign.MemorySegment",
            "java.util.stream.Stream",
            "java.util.Iterator"
    );

    public static final Set<String> DEFAULT_DERIVED_EQUALITY_ANNOTATIONS = Set.of(
            "lombok.Value",
            "lombok.Data",
            "lombok.EqualsAndHashCode"
    );

    public ResolverRules {
        if (universalBaseType == null || universalBaseType.isBlank()) {
            throw new IllegalArgumentException("universalBaseType must not be blank");
        }
        valueLikeTypes = copyOf("valueLikeTypes", valueLikeTypes);
        knownNonValueWrappers = copyOf("knownNonValueWrappers", knownNonValueWrappers);
        derivedEqualityAnnotations = copyOf("derivedEqualityAnnotations", derivedEqualityAnnotations);
        bufferOverlayAnnotations = copyOf("bufferOverlayAnnotations", bufferOverlayAnnotations);
    }

    /**
     * Rules for Java sources.
     */
    public static ResolverRules defaults() {
        return new ResolverRules(
                "java.lang.Object",
                DEFAULT_VALUE_LIKE_TYPES,
                DEFAULT_KNOWN_NON_VALUE_WRAPPERS,
                DEFAULT_DERIVED_EQUALITY_ANNOTATIONS,
                Set.of());
    }

    private static Set<String> copyOf(String name, Set<String> values) {
        if (values == null) {
            return Set.of();
        }
        for (String value : values) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not contain blank entries");
            }
        }
        return Set.copyOf(values);
    }
}
