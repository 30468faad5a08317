package com.vidnyan.rva.adapter.out.parser;

import com.github.javaparser.resolution.declarations.ResolvedFieldDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.types.ResolvedPrimitiveType;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;
import com.vidnyan.rva.domain.model.Member;
import com.vidnyan.rva.domain.model.TypeCategory;
import com.vidnyan.rva.domain.model.TypeRef;
import com.vidnyan.rva.domain.model.TypeShape;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TypeRef} over a JavaParser {@link ResolvedType}.
 * <p>
 * {@code Optional<T>} is a nullable value wrapper around {@code T}; the primitive
 * optionals unwrap to their primitive. Shape and members are resolved lazily and cached.
 * Not thread-safe: the symbol solver behind it is not.
 */
@Slf4j
public final class ResolvedTypeRef implements TypeRef {

    private static final Map<String, ResolvedPrimitiveType> PRIMITIVE_OPTIONALS = Map.of(
            "java.util.OptionalInt", ResolvedPrimitiveType.INT,
            "java.util.OptionalLong", ResolvedPrimitiveType.LONG,
            "java.util.OptionalDouble", ResolvedPrimitiveType.DOUBLE
    );

    private final ResolvedType type;
    private final String description;
    private TypeShape shape;
    private List<Member> members;

    private ResolvedTypeRef(ResolvedType type) {
        this.type = type;
        this.description = type.describe();
    }

    public static ResolvedTypeRef of(ResolvedType type) {
        return new ResolvedTypeRef(type);
    }

    @Override
    public Object identity() {
        return description;
    }

    @Override
    public String displayName() {
        return description;
    }

    @Override
    public TypeShape shape() {
        if (shape == null) {
            shape = computeShape();
        }
        return shape;
    }

    @Override
    public boolean isNullableValueWrapper() {
        if (!type.isReferenceType()) {
            return false;
        }
        String name = type.asReferenceType().getQualifiedName();
        return JavaTypeShapes.OPTIONAL.equals(name) || PRIMITIVE_OPTIONALS.containsKey(name);
    }

    @Override
    public Optional<TypeRef> unwrap() {
        if (!isNullableValueWrapper()) {
            return Optional.empty();
        }
        ResolvedReferenceType reference = type.asReferenceType();
        ResolvedPrimitiveType primitive = PRIMITIVE_OPTIONALS.get(reference.getQualifiedName());
        if (primitive != null) {
            return Optional.of(of(primitive));
        }
        List<ResolvedType> arguments = reference.typeParametersValues();
        if (arguments.size() != 1) {
            return Optional.empty();
        }
        ResolvedType argument = arguments.get(0);
        if (argument.isWildcard()) {
            if (!argument.asWildcard().isBounded()) {
                return Optional.empty();
            }
            argument = argument.asWildcard().getBoundedType();
        }
        return Optional.of(of(argument));
    }

    /**
     * Declared non-static fields, in declaration order.
     */
    @Override
    public List<Member> members() {
        if (members == null) {
            members = computeMembers();
        }
        return members;
    }

    @Override
    public List<Member> tupleElements() {
        return List.of();
    }

    @Override
    public String toString() {
        return description;
    }

    private TypeShape computeShape() {
        if (type.isPrimitive()) {
            return TypeShape.of(TypeCategory.PRIMITIVE, description);
        }
        if (type.isArray()) {
            return TypeShape.of(TypeCategory.ARRAY, description);
        }
        if (type.isTypeVariable()) {
            return TypeShape.of(TypeCategory.TYPE_PARAMETER, description);
        }
        if (!type.isReferenceType()) {
            return TypeShape.of(TypeCategory.OTHER, description);
        }
        ResolvedReferenceType reference = type.asReferenceType();
        try {
            Optional<ResolvedReferenceTypeDeclaration> declaration = reference.getTypeDeclaration();
            if (declaration.isPresent()) {
                return JavaTypeShapes.ofResolved(declaration.get());
            }
        } catch (RuntimeException e) {
            log.debug("Could not resolve declaration of {}: {}", description, e.getMessage());
        }
        return TypeShape.of(TypeCategory.OTHER, reference.getQualifiedName());
    }

    private List<Member> computeMembers() {
        if (!type.isReferenceType()) {
            return List.of();
        }
        List<Member> result = new ArrayList<>();
        try {
            Optional<ResolvedReferenceTypeDeclaration> declaration = type.asReferenceType().getTypeDeclaration();
            if (declaration.isEmpty()) {
                return List.of();
            }
            for (ResolvedFieldDeclaration field : declaration.get().getDeclaredFields()) {
                if (!field.isStatic()) {
                    result.add(Member.of(field.getName(), of(field.getType())));
                }
            }
        } catch (RuntimeException e) {
            log.debug("Could not resolve fields of {}: {}", description, e.getMessage());
            return List.of();
        }
        return List.copyOf(result);
    }
}
