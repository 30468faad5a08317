package com.vidnyan.rva.domain.finding;

import com.vidnyan.rva.domain.model.Location;
import com.vidnyan.rva.domain.model.TypeRef;
import com.vidnyan.rva.domain.model.TypeShape;

import java.util.List;

/**
 * A derived-equality type under test: a record, or a class whose equality is generated
 * from its fields. Each component is checked as an independent top-level member.
 */
public record RecordUnit(
    String qualifiedName,
    TypeShape shape,
    List<Component> components,
    Location location
) {

    public RecordUnit {
        components = components == null ? List.of() : List.copyOf(components);
    }

    /**
     * A record component or field.
     *
     * @param type the resolved type, or null when the host could not resolve it
     */
    public record Component(
        String name,
        TypeRef type,
        String declaredType,
        Location location
    ) {

        public boolean isResolved() {
            return type != null;
        }

        /**
         * The type as displayed in findings, falling back to the source spelling.
         */
        public String typeDisplayName() {
            return type != null ? type.displayName() : declaredType;
        }
    }
}
