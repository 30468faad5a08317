package com.vidnyan.rva.config;

import com.vidnyan.rva.domain.semantics.ResolverRules;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Name tables for the kind resolver.
 * Can be configured via application.properties or application.yml
 */
@Data
@ConfigurationProperties(prefix = "rva.classifier")
public class ClassifierProperties {

    /**
     * Universal base type; members of this type can never be proven value-safe.
     */
    private String universalBaseType = "java.lang.Object";

    /**
     * Types treated like primitives (content equality, no further inspection).
     */
    private Set<String> valueLikeTypes = new LinkedHashSet<>(ResolverRules.DEFAULT_VALUE_LIKE_TYPES);

    /**
     * Types whose equality compares an underlying buffer or view by identity.
     */
    private Set<String> knownNonValueWrappers = new LinkedHashSet<>(ResolverRules.DEFAULT_KNOWN_NON_VALUE_WRAPPERS);

    /**
     * Annotations that make a class's equality derived from its fields.
     */
    private Set<String> derivedEqualityAnnotations =
            new LinkedHashSet<>(ResolverRules.DEFAULT_DERIVED_EQUALITY_ANNOTATIONS);

    /**
     * Annotations marking a struct as a fixed-size inline buffer.
     */
    private Set<String> bufferOverlayAnnotations = new LinkedHashSet<>();

    public ResolverRules toRules() {
        return new ResolverRules(
                universalBaseType,
                valueLikeTypes,
                knownNonValueWrappers,
                derivedEqualityAnnotations,
                bufferOverlayAnnotations);
    }
}
