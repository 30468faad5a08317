package com.vidnyan.rva.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.rva.domain.finding.RecordValueChecker;
import com.vidnyan.rva.domain.semantics.KindResolver;
import com.vidnyan.rva.domain.semantics.ResolverRules;
import com.vidnyan.rva.domain.semantics.ValueSemanticsClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for RVA components.
 * Wires the framework-free domain into the application.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ClassifierProperties.class, AnalysisProperties.class})
public class RvaConfiguration {

    /**
     * ObjectMapper for the JSON report.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public KindResolver kindResolver(ClassifierProperties properties) {
        ResolverRules rules = properties.toRules();
        log.info("Kind resolver: {} value-like types, {} known non-value wrappers, {} derived-equality annotations",
                rules.valueLikeTypes().size(),
                rules.knownNonValueWrappers().size(),
                rules.derivedEqualityAnnotations().size());
        return new KindResolver(rules);
    }

    @Bean
    public ValueSemanticsClassifier valueSemanticsClassifier(KindResolver kindResolver) {
        return new ValueSemanticsClassifier(kindResolver);
    }

    @Bean
    public RecordValueChecker recordValueChecker(ValueSemanticsClassifier classifier, KindResolver kindResolver) {
        return new RecordValueChecker(classifier, kindResolver);
    }
}
