package com.vidnyan.rva.domain.semantics;

import com.vidnyan.rva.domain.model.Member;
import com.vidnyan.rva.domain.model.TypeRef;
import com.vidnyan.rva.domain.model.TypeShape;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a member type has value semantics.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>Unwrap a nullable value wrapper; an absent type is OK.</li>
 *   <li>A type already visited in this call is OK (cycle break).</li>
 *   <li>Untyped or universal base: FAILED.</li>
 *   <li>Primitive or enum: OK.</li>
 *   <li>Fixed-size buffer overlay: FAILED.</li>
 *   <li>Known non-value wrapper: FAILED, even if it declares {@code equals(T)}.</li>
 *   <li>Except for tuples: own {@code equals(T)}, own {@code equals(Object)} override,
 *       or derived-equality composite is OK; reference composite is FAILED.</li>
 *   <li>Tuples and value composites: first failing member gives NESTED_FAILED.</li>
 *   <li>Anything else: FAILED.</li>
 * </ol>
 * Holds no state between calls and never throws for well-behaved {@link TypeRef}s.
 */
@Slf4j
public class ValueSemanticsClassifier {

    private final KindResolver kindResolver;

    public ValueSemanticsClassifier() {
        this(new KindResolver());
    }

    public ValueSemanticsClassifier(KindResolver kindResolver) {
        this.kindResolver = kindResolver;
    }

    /**
     * Classify one top-level member type with a fresh {@link CycleGuard}.
     */
    public Verdict classify(TypeRef type) {
        return classify(type, new CycleGuard());
    }

    public Verdict classify(TypeRef type, CycleGuard guard) {
        if (type != null && type.isNullableValueWrapper()) {
            Optional<TypeRef> underlying = type.unwrap();
            if (underlying.isEmpty()) {
                return Verdict.ok();
            }
            type = underlying.get();
        }
        if (type == null) {
            return Verdict.ok();
        }

        if (!guard.add(type.identity())) {
            log.trace("Already visited {}, treating as OK", type.displayName());
            return Verdict.ok();
        }

        TypeShape shape = type.shape();
        Kind kind = kindResolver.kindOf(shape);

        switch (kind) {
            case UNTYPED_OR_UNIVERSAL_BASE:
            case FIXED_SIZE_BUFFER_OVERLAY:
            case KNOWN_NON_VALUE_WRAPPER:
                return failed(type, kind);
            case PRIMITIVE:
            case ENUM_LIKE:
                return Verdict.ok();
            default:
                break;
        }

        if (kind != Kind.HETEROGENEOUS_FIXED_TUPLE) {
            EqualityCapability capability = kindResolver.capabilityOf(shape, kind);
            if (capability.hasOwnValueEqualsMethod() || capability.hasOwnIdentityEqualsOverride()) {
                return Verdict.ok();
            }
            if (kind == Kind.DERIVED_EQUALITY_COMPOSITE) {
                // checked as its own unit
                return Verdict.ok();
            }
            if (kind == Kind.REFERENCE_COMPOSITE) {
                return failed(type, kind);
            }
        }

        List<Member> members = membersOf(type, kind);
        if (members == null) {
            return failed(type, kind);
        }

        for (Member member : members) {
            Verdict verdict = classify(member.type(), guard);
            if (!verdict.isOk()) {
                String inner = member.type().displayName();
                log.trace("{} fails through member {} ({})", type.displayName(), member.name(), inner);
                return Verdict.nestedFailed(inner);
            }
        }
        return Verdict.ok();
    }

    /**
     * Tuple elements for tuples, declared members for value composites, null otherwise.
     */
    private List<Member> membersOf(TypeRef type, Kind kind) {
        if (kind == Kind.HETEROGENEOUS_FIXED_TUPLE) {
            return type.tupleElements();
        }
        if (kind == Kind.VALUE_COMPOSITE) {
            return type.members();
        }
        return null;
    }

    private Verdict failed(TypeRef type, Kind kind) {
        log.trace("{} lacks value semantics ({})", type.displayName(), kind);
        return Verdict.failed();
    }
}
