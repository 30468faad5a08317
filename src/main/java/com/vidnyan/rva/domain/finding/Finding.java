package com.vidnyan.rva.domain.finding;

import com.vidnyan.rva.domain.model.Location;
import com.vidnyan.rva.domain.semantics.Verdict;

/**
 * One offending top-level member of a derived-equality type.
 * Immutable value object.
 */
public record Finding(
    String diagnosticId,
    String recordName,
    String memberName,
    String memberType,
    Verdict verdict,
    String message,
    Location location
) {

    public static final String DIAGNOSTIC_ID = "RVA01";

    public static Finding of(String recordName, RecordUnit.Component component, Verdict verdict) {
        String args = component.typeDisplayName() + " " + component.name();
        if (verdict.isNested()) {
            args += " (field " + verdict.innerTypeDisplayName() + ")";
        }
        return new Finding(
                DIAGNOSTIC_ID,
                recordName,
                component.name(),
                component.typeDisplayName(),
                verdict,
                "Member '" + args + "' does not have value semantics",
                component.location());
    }

    public boolean isNested() {
        return verdict.isNested();
    }
}
