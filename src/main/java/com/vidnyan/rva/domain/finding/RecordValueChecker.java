package com.vidnyan.rva.domain.finding;

import com.vidnyan.rva.domain.semantics.EqualityCapability;
import com.vidnyan.rva.domain.semantics.KindResolver;
import com.vidnyan.rva.domain.semantics.ValueSemanticsClassifier;
import com.vidnyan.rva.domain.semantics.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks every component of a derived-equality type and reports one finding
 * per component that lacks value semantics.
 */
@Slf4j
public class RecordValueChecker {

    private final ValueSemanticsClassifier classifier;
    private final KindResolver kindResolver;

    public RecordValueChecker(ValueSemanticsClassifier classifier, KindResolver kindResolver) {
        this.classifier = classifier;
        this.kindResolver = kindResolver;
    }

    /**
     * A unit that declares {@code equals(T)} or overrides {@code equals(Object)} controls
     * its own equality and is not checked.
     */
    public boolean declaresOwnEquality(RecordUnit unit) {
        EqualityCapability own = kindResolver.capabilityOf(unit.shape());
        return own.any();
    }

    public List<Finding> check(RecordUnit unit) {
        if (declaresOwnEquality(unit)) {
            log.debug("{} declares its own equals, skipping components", unit.qualifiedName());
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        for (RecordUnit.Component component : unit.components()) {
            if (!component.isResolved()) {
                log.debug("Skipping {}.{}: type {} could not be resolved",
                        unit.qualifiedName(), component.name(), component.declaredType());
                continue;
            }
            Verdict verdict = classifier.classify(component.type());
            if (!verdict.isOk()) {
                findings.add(Finding.of(unit.qualifiedName(), component, verdict));
            }
        }
        return findings;
    }
}
