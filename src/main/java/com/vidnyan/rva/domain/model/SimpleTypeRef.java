package com.vidnyan.rva.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory {@link TypeRef} for hosts that describe their types programmatically.
 * <p>
 * Members can be attached after construction, which is how cyclic graphs are built:
 * <pre>
 * SimpleTypeRef a = SimpleTypeRef.struct("A");
 * SimpleTypeRef b = SimpleTypeRef.struct("B").member("a", a);
 * a.member("b", b);
 * </pre>
 * Identity is instance identity; {@code equals} is not overridden.
 */
public final class SimpleTypeRef implements TypeRef {

    public static final String OBJECT = "java.lang.Object";

    private final String displayName;
    private final boolean nullableWrapper;
    private final TypeRef wrapped;
    private TypeCategory category;
    private final String qualifiedName;
    private final Set<String> annotations = new HashSet<>();
    private final List<MethodShape> methods = new ArrayList<>();
    private final List<Member> members = new ArrayList<>();
    private final List<Member> tupleElements = new ArrayList<>();

    private SimpleTypeRef(String displayName, TypeCategory category, String qualifiedName,
                          boolean nullableWrapper, TypeRef wrapped) {
        this.displayName = displayName;
        this.category = category;
        this.qualifiedName = qualifiedName;
        this.nullableWrapper = nullableWrapper;
        this.wrapped = wrapped;
    }

    public static SimpleTypeRef of(TypeCategory category, String qualifiedName) {
        return new SimpleTypeRef(qualifiedName, category, qualifiedName, false, null);
    }

    public static SimpleTypeRef primitive(String name) {
        return of(TypeCategory.PRIMITIVE, name);
    }

    public static SimpleTypeRef enumType(String name) {
        return of(TypeCategory.ENUM, name);
    }

    public static SimpleTypeRef object() {
        return of(TypeCategory.CLASS, OBJECT);
    }

    public static SimpleTypeRef untyped() {
        return of(TypeCategory.UNTYPED, "dynamic");
    }

    public static SimpleTypeRef classType(String name) {
        return of(TypeCategory.CLASS, name);
    }

    public static SimpleTypeRef interfaceType(String name) {
        return of(TypeCategory.INTERFACE, name);
    }

    public static SimpleTypeRef record(String name) {
        return of(TypeCategory.RECORD, name);
    }

    public static SimpleTypeRef struct(String name) {
        return of(TypeCategory.STRUCT, name);
    }

    public static SimpleTypeRef typeParameter(String name) {
        return of(TypeCategory.TYPE_PARAMETER, name);
    }

    public static SimpleTypeRef array(TypeRef element) {
        String name = element.displayName() + "[]";
        return new SimpleTypeRef(name, TypeCategory.ARRAY, name, false, null);
    }

    /**
     * A tuple whose elements are named {@code Item1}, {@code Item2}, ...
     * and whose display name lists the element types, e.g. {@code (int, string)}.
     */
    public static SimpleTypeRef tuple(TypeRef... elements) {
        String name = "(" + List.of(elements).stream()
                .map(TypeRef::displayName)
                .collect(Collectors.joining(", ")) + ")";
        SimpleTypeRef tuple = new SimpleTypeRef(name, TypeCategory.TUPLE, name, false, null);
        for (int i = 0; i < elements.length; i++) {
            tuple.tupleElements.add(Member.of("Item" + (i + 1), elements[i]));
        }
        return tuple;
    }

    /**
     * A nullable value wrapper around {@code inner}, displayed as {@code inner?}.
     */
    public static SimpleTypeRef nullable(TypeRef inner) {
        String name = inner.displayName() + "?";
        return new SimpleTypeRef(name, TypeCategory.OTHER, name, true, inner);
    }

    /**
     * A nullable value wrapper whose underlying type cannot be determined.
     */
    public static SimpleTypeRef unresolvedNullable(String name) {
        return new SimpleTypeRef(name, TypeCategory.OTHER, name, true, null);
    }

    public SimpleTypeRef member(String name, TypeRef type) {
        members.add(Member.of(name, type));
        return this;
    }

    public SimpleTypeRef annotation(String name) {
        annotations.add(name);
        return this;
    }

    public SimpleTypeRef method(MethodShape method) {
        methods.add(method);
        return this;
    }

    /**
     * Declare an {@code equals(T)} overload on this type.
     */
    public SimpleTypeRef withValueEquals() {
        return method(MethodShape.valueEquals(qualifiedName));
    }

    /**
     * Declare an {@code equals(Object)} override on this type.
     */
    public SimpleTypeRef withIdentityEqualsOverride() {
        return method(MethodShape.identityEqualsOverride(qualifiedName, OBJECT));
    }

    public SimpleTypeRef category(TypeCategory newCategory) {
        this.category = newCategory;
        return this;
    }

    @Override
    public Object identity() {
        return this;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public TypeShape shape() {
        return new TypeShape(category, qualifiedName, annotations, methods);
    }

    @Override
    public boolean isNullableValueWrapper() {
        return nullableWrapper;
    }

    @Override
    public Optional<TypeRef> unwrap() {
        return Optional.ofNullable(wrapped);
    }

    @Override
    public List<Member> members() {
        return Collections.unmodifiableList(members);
    }

    @Override
    public List<Member> tupleElements() {
        return Collections.unmodifiableList(tupleElements);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
