package com.vidnyan.rva.adapter.out.parser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;
import com.vidnyan.rva.domain.model.MethodShape;
import com.vidnyan.rva.domain.model.TypeCategory;
import com.vidnyan.rva.domain.model.TypeShape;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds {@link TypeShape}s from JavaParser declarations.
 * <p>
 * Source declarations are read from the AST; binary (reflection) declarations
 * from their resolved members. Java overrides implicitly, so every concrete
 * {@code equals(Object)} is reported as overriding the base slot; other methods
 * only when annotated {@code @Override}. An abstract {@code equals(Object)},
 * as redeclared by {@code java.util.Collection}, supplies no implementation and
 * is never reported as overriding.
 */
@Slf4j
final class JavaTypeShapes {

    static final String OBJECT = "java.lang.Object";
    static final String RECORD = "java.lang.Record";
    static final String OPTIONAL = "java.util.Optional";

    private static final String EQUALS = "equals";

    private JavaTypeShapes() {
    }

    /**
     * Shape of a type declared in source.
     */
    static TypeShape ofDeclaration(TypeDeclaration<?> declaration) {
        String qualifiedName = qualifiedNameOf(declaration);
        CompilationUnit cu = declaration.findCompilationUnit().orElse(null);

        Set<String> annotations = new LinkedHashSet<>();
        for (AnnotationExpr annotation : declaration.getAnnotations()) {
            annotations.add(qualifyAnnotation(annotation, cu));
        }

        List<MethodShape> methods = new ArrayList<>();
        for (MethodDeclaration method : declaration.getMethodsByName(EQUALS)) {
            methods.add(methodShape(method, declaration, qualifiedName, cu));
        }

        return new TypeShape(categoryOf(declaration), qualifiedName, annotations, methods);
    }

    /**
     * Shape of a resolved declaration, read from its AST when it has one.
     */
    static TypeShape ofResolved(ResolvedReferenceTypeDeclaration declaration) {
        Optional<? extends Node> ast = astOf(declaration);
        if (ast.isPresent() && ast.get() instanceof TypeDeclaration<?> typeDeclaration) {
            return ofDeclaration(typeDeclaration);
        }

        List<MethodShape> methods = new ArrayList<>();
        for (ResolvedMethodDeclaration method : declaration.getDeclaredMethods()) {
            if (!EQUALS.equals(method.getName())) {
                continue;
            }
            try {
                methods.add(methodShape(method));
            } catch (RuntimeException e) {
                log.debug("Could not resolve {}.{}: {}", declaration.getQualifiedName(),
                        method.getName(), e.getMessage());
            }
        }
        return new TypeShape(categoryOf(declaration), declaration.getQualifiedName(), Set.of(), methods);
    }

    static Optional<? extends Node> astOf(ResolvedReferenceTypeDeclaration declaration) {
        try {
            return declaration.toAst();
        } catch (UnsupportedOperationException e) {
            return Optional.empty();
        }
    }

    static String qualifiedNameOf(TypeDeclaration<?> declaration) {
        return declaration.getFullyQualifiedName().orElse(declaration.getNameAsString());
    }

    private static TypeCategory categoryOf(TypeDeclaration<?> declaration) {
        if (declaration instanceof RecordDeclaration) {
            return TypeCategory.RECORD;
        }
        if (declaration instanceof EnumDeclaration) {
            return TypeCategory.ENUM;
        }
        if (declaration instanceof AnnotationDeclaration) {
            return TypeCategory.INTERFACE;
        }
        if (declaration instanceof ClassOrInterfaceDeclaration classOrInterface) {
            return classOrInterface.isInterface() ? TypeCategory.INTERFACE : TypeCategory.CLASS;
        }
        return TypeCategory.OTHER;
    }

    private static TypeCategory categoryOf(ResolvedReferenceTypeDeclaration declaration) {
        if (declaration.isEnum()) {
            return TypeCategory.ENUM;
        }
        if (declaration.isInterface() || declaration.isAnnotation()) {
            return TypeCategory.INTERFACE;
        }
        if (extendsRecord(declaration)) {
            return TypeCategory.RECORD;
        }
        if (declaration.isClass()) {
            return TypeCategory.CLASS;
        }
        return TypeCategory.OTHER;
    }

    private static boolean extendsRecord(ResolvedReferenceTypeDeclaration declaration) {
        try {
            return declaration.getAncestors(true).stream()
                    .anyMatch(ancestor -> RECORD.equals(ancestor.getQualifiedName()));
        } catch (RuntimeException e) {
            log.debug("Could not resolve ancestors of {}: {}", declaration.getQualifiedName(), e.getMessage());
            return false;
        }
    }

    private static MethodShape methodShape(MethodDeclaration method, TypeDeclaration<?> owner,
                                           String ownerName, CompilationUnit cu) {
        List<MethodShape.Parameter> parameters = new ArrayList<>();
        for (Parameter parameter : method.getParameters()) {
            parameters.add(parameterOf(parameter.getType(), owner, ownerName, cu));
        }
        boolean equalsObject = parameters.size() == 1 && OBJECT.equals(parameters.get(0).typeName());
        boolean isAbstract = method.isAbstract() || (method.getBody().isEmpty() && !method.isDefault());
        return new MethodShape(
                method.getNameAsString(),
                parameters,
                method.isStatic(),
                isAbstract,
                !isAbstract && (equalsObject || method.isAnnotationPresent("Override")),
                ownerName);
    }

    private static MethodShape methodShape(ResolvedMethodDeclaration method) {
        List<MethodShape.Parameter> parameters = new ArrayList<>();
        for (int i = 0; i < method.getNumberOfParams(); i++) {
            parameters.add(parameterOf(method.getParam(i).getType()));
        }
        boolean equalsObject = parameters.size() == 1 && OBJECT.equals(parameters.get(0).typeName());
        return new MethodShape(
                method.getName(),
                parameters,
                method.isStatic(),
                method.isAbstract(),
                equalsObject && !method.isAbstract(),
                method.declaringType().getQualifiedName());
    }

    private static MethodShape.Parameter parameterOf(Type type, TypeDeclaration<?> owner,
                                                     String ownerName, CompilationUnit cu) {
        try {
            return parameterOf(type.resolve());
        } catch (RuntimeException e) {
            log.debug("Could not resolve parameter type {}: {}", type, e.getMessage());
        }
        // fall back to the source spelling
        String written = type.asString();
        if (written.equals(owner.getNameAsString())) {
            return MethodShape.Parameter.of(ownerName);
        }
        if ("Object".equals(written)) {
            return MethodShape.Parameter.of(OBJECT);
        }
        return MethodShape.Parameter.of(qualify(written, cu));
    }

    private static MethodShape.Parameter parameterOf(ResolvedType type) {
        if (!type.isReferenceType()) {
            return MethodShape.Parameter.of(type.describe());
        }
        ResolvedReferenceType reference = type.asReferenceType();
        if (OPTIONAL.equals(reference.getQualifiedName()) && reference.typeParametersValues().size() == 1) {
            ResolvedType wrapped = reference.typeParametersValues().get(0);
            if (wrapped.isReferenceType()) {
                return MethodShape.Parameter.wrapped(wrapped.asReferenceType().getQualifiedName());
            }
        }
        return MethodShape.Parameter.of(reference.getQualifiedName());
    }

    /**
     * Qualify an annotation name the way the compiler would: a single-type import first,
     * then the symbol solver (same package, source tree, JDK), then a sole on-demand import.
     * A name still ambiguous after that is returned as written.
     */
    static String qualifyAnnotation(AnnotationExpr annotation, CompilationUnit cu) {
        String name = annotation.getNameAsString();
        String qualified = qualify(name, cu);
        if (!qualified.equals(name) || name.contains(".")) {
            return qualified;
        }
        try {
            return annotation.resolve().getQualifiedName();
        } catch (RuntimeException e) {
            log.trace("Could not resolve annotation @{}: {}", name, e.getMessage());
        }
        return qualifyOnDemand(name, cu);
    }

    /**
     * Qualify a simple name through a single-type import, or failing that through the
     * only on-demand import of the compilation unit.
     */
    static String qualifyImported(String name, CompilationUnit cu) {
        String qualified = qualify(name, cu);
        return qualified.equals(name) ? qualifyOnDemand(name, cu) : qualified;
    }

    private static String qualifyOnDemand(String name, CompilationUnit cu) {
        if (name.contains(".") || cu == null) {
            return name;
        }
        List<String> onDemand = cu.getImports().stream()
                .filter(i -> i.isAsterisk() && !i.isStatic())
                .map(ImportDeclaration::getNameAsString)
                .toList();
        return onDemand.size() == 1 ? onDemand.get(0) + "." + name : name;
    }

    /**
     * Qualify a simple name through the single-type imports of its compilation unit.
     */
    static String qualify(String name, CompilationUnit cu) {
        if (name.contains(".") || cu == null) {
            return name;
        }
        for (ImportDeclaration importDeclaration : cu.getImports()) {
            if (importDeclaration.isAsterisk() || importDeclaration.isStatic()) {
                continue;
            }
            String imported = importDeclaration.getNameAsString();
            if (imported.endsWith("." + name)) {
                return imported;
            }
        }
        return name;
    }
}
