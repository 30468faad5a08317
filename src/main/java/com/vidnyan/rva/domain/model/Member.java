package com.vidnyan.rva.domain.model;

/**
 * A named member (field, property, record component or tuple element) and its type.
 */
public record Member(String name, TypeRef type) {

    public static Member of(String name, TypeRef type) {
        return new Member(name, type);
    }
}
