package com.vidnyan.rva.domain.semantics;

import com.vidnyan.rva.domain.model.MethodShape;
import com.vidnyan.rva.domain.model.TypeCategory;
import com.vidnyan.rva.domain.model.TypeShape;

/**
 * Derives the {@link Kind} and {@link EqualityCapability} of a type from its raw shape.
 * <p>
 * All tie-breaks live here. {@link #kindOf(TypeShape)} is a single ordered table,
 * first match wins:
 * <ol>
 *   <li>untyped, or the universal base type: {@link Kind#UNTYPED_OR_UNIVERSAL_BASE}</li>
 *   <li>primitive, or a configured value-like type: {@link Kind#PRIMITIVE}</li>
 *   <li>enum: {@link Kind#ENUM_LIKE}</li>
 *   <li>array, or a struct with a buffer-overlay annotation: {@link Kind#FIXED_SIZE_BUFFER_OVERLAY}</li>
 *   <li>configured wrapper name: {@link Kind#KNOWN_NON_VALUE_WRAPPER}</li>
 *   <li>tuple: {@link Kind#HETEROGENEOUS_FIXED_TUPLE}</li>
 *   <li>record, or a derived-equality annotation: {@link Kind#DERIVED_EQUALITY_COMPOSITE}</li>
 *   <li>class: {@link Kind#REFERENCE_COMPOSITE}</li>
 *   <li>struct: {@link Kind#VALUE_COMPOSITE}</li>
 *   <li>anything else: {@link Kind#TYPE_PARAMETER_OR_OTHER}</li>
 * </ol>
 * Stateless and thread-safe.
 */
public class KindResolver {

    private static final String EQUALS = "equals";

    private final ResolverRules rules;

    public KindResolver() {
        this(ResolverRules.defaults());
    }

    public KindResolver(ResolverRules rules) {
        this.rules = rules;
    }

    public ResolverRules rules() {
        return rules;
    }

    public Kind kindOf(TypeShape shape) {
        TypeCategory category = shape.category();
        String name = shape.qualifiedName();

        if (category == TypeCategory.UNTYPED || rules.universalBaseType().equals(name)) {
            return Kind.UNTYPED_OR_UNIVERSAL_BASE;
        }
        if (category == TypeCategory.PRIMITIVE || rules.valueLikeTypes().contains(name)) {
            return Kind.PRIMITIVE;
        }
        if (category == TypeCategory.ENUM) {
            return Kind.ENUM_LIKE;
        }
        if (category == TypeCategory.ARRAY
                || (category == TypeCategory.STRUCT && shape.hasAnyAnnotation(rules.bufferOverlayAnnotations()))) {
            return Kind.FIXED_SIZE_BUFFER_OVERLAY;
        }
        if (rules.knownNonValueWrappers().contains(name)) {
            return Kind.KNOWN_NON_VALUE_WRAPPER;
        }
        if (category == TypeCategory.TUPLE) {
            return Kind.HETEROGENEOUS_FIXED_TUPLE;
        }
        if (category == TypeCategory.RECORD || shape.hasAnyAnnotation(rules.derivedEqualityAnnotations())) {
            return Kind.DERIVED_EQUALITY_COMPOSITE;
        }
        if (category == TypeCategory.CLASS) {
            return Kind.REFERENCE_COMPOSITE;
        }
        if (category == TypeCategory.STRUCT) {
            return Kind.VALUE_COMPOSITE;
        }
        return Kind.TYPE_PARAMETER_OR_OTHER;
    }

    public EqualityCapability capabilityOf(TypeShape shape) {
        return capabilityOf(shape, kindOf(shape));
    }

    /**
     * Tuples report no capability: only their element types matter.
     */
    public EqualityCapability capabilityOf(TypeShape shape, Kind kind) {
        if (kind == Kind.HETEROGENEOUS_FIXED_TUPLE) {
            return EqualityCapability.NONE;
        }
        boolean valueEquals = false;
        boolean identityOverride = false;
        for (MethodShape method : shape.declaredMethods()) {
            valueEquals |= isOwnValueEquals(method, shape, kind);
            identityOverride |= isOwnIdentityEqualsOverride(method, shape);
        }
        return new EqualityCapability(valueEquals, identityOverride);
    }

    /**
     * {@code equals(T)} declared here, instance, concrete, not re-exposing a base slot.
     * Value composites may also take a nullable wrapper of themselves.
     */
    private boolean isOwnValueEquals(MethodShape method, TypeShape shape, Kind kind) {
        if (!isOwnEqualsCandidate(method, shape) || method.isAbstract() || method.overridesBase()) {
            return false;
        }
        MethodShape.Parameter parameter = method.parameters().get(0);
        if (!shape.qualifiedName().equals(parameter.typeName())) {
            return false;
        }
        return !parameter.nullableWrapped() || kind == Kind.VALUE_COMPOSITE;
    }

    /**
     * {@code equals(Object)} explicitly overriding the base slot, declared here.
     */
    private boolean isOwnIdentityEqualsOverride(MethodShape method, TypeShape shape) {
        if (!isOwnEqualsCandidate(method, shape) || !method.overridesBase()) {
            return false;
        }
        MethodShape.Parameter parameter = method.parameters().get(0);
        return !parameter.nullableWrapped() && rules.universalBaseType().equals(parameter.typeName());
    }

    private boolean isOwnEqualsCandidate(MethodShape method, TypeShape shape) {
        return EQUALS.equals(method.name())
                && method.hasSingleParameter()
                && !method.isStatic()
                && shape.qualifiedName().equals(method.declaringType());
    }
}
