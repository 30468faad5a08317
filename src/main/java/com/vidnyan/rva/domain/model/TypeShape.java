package com.vidnyan.rva.domain.model;

import java.util.List;
import java.util.Set;

/**
 * Raw, host-neutral description of a type.
 * Immutable value object.
 */
public record TypeShape(
    TypeCategory category,
    String qualifiedName,
    Set<String> annotations,
    List<MethodShape> declaredMethods
) {

    public TypeShape {
        annotations = annotations == null ? Set.of() : Set.copyOf(annotations);
        declaredMethods = declaredMethods == null ? List.of() : List.copyOf(declaredMethods);
    }

    public static TypeShape of(TypeCategory category, String qualifiedName) {
        return new TypeShape(category, qualifiedName, Set.of(), List.of());
    }

    public TypeShape withAnnotations(Set<String> names) {
        return new TypeShape(category, qualifiedName, names, declaredMethods);
    }

    public TypeShape withMethods(List<MethodShape> methods) {
        return new TypeShape(category, qualifiedName, annotations, methods);
    }

    /**
     * Simple name of the type, the last segment of the qualified name.
     */
    public String simpleName() {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);
    }

    /**
     * Check if this type carries any of the given annotations.
     * A qualified annotation matches a configured name exactly or by its simple name;
     * an unqualified one, which the host could not resolve, matches on simple name alone.
     */
    public boolean hasAnyAnnotation(Set<String> names) {
        for (String annotation : annotations) {
            String simple = annotation.substring(annotation.lastIndexOf('.') + 1);
            for (String name : names) {
                if (annotation.equals(name) || simple.equals(name)
                        || (!annotation.contains(".") && name.endsWith("." + simple))) {
                    return true;
                }
            }
        }
        return false;
    }
}
