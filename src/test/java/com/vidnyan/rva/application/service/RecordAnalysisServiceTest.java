package com.vidnyan.rva.application.service;

import com.vidnyan.rva.application.port.in.AnalyzeRecordsUseCase.AnalysisRequest;
import com.vidnyan.rva.application.port.in.AnalyzeRecordsUseCase.AnalysisResult;
import com.vidnyan.rva.application.port.out.RecordSource;
import com.vidnyan.rva.domain.finding.RecordUnit;
import com.vidnyan.rva.domain.finding.RecordValueChecker;
import com.vidnyan.rva.domain.model.Location;
import com.vidnyan.rva.domain.model.MethodShape;
import com.vidnyan.rva.domain.model.SimpleTypeRef;
import com.vidnyan.rva.domain.model.TypeCategory;
import com.vidnyan.rva.domain.model.TypeRef;
import com.vidnyan.rva.domain.model.TypeShape;
import com.vidnyan.rva.domain.semantics.KindResolver;
import com.vidnyan.rva.domain.semantics.ValueSemanticsClassifier;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecordAnalysisServiceTest {

    private final KindResolver kindResolver = new KindResolver();
    private final RecordValueChecker checker =
            new RecordValueChecker(new ValueSemanticsClassifier(kindResolver), kindResolver);

    @Test
    void analyze_ShouldCheckEveryUnitAndCollectStats() {
        // Arrange
        RecordUnit order = unit("com.example.Order", TypeShape.of(TypeCategory.RECORD, "com.example.Order"),
                component("id", SimpleTypeRef.primitive("long")),
                component("payload", SimpleTypeRef.array(SimpleTypeRef.primitive("byte"))));
        RecordUnit customer = unit("com.example.Customer", TypeShape.of(TypeCategory.RECORD, "com.example.Customer"),
                component("owner", SimpleTypeRef.object()),
                component("name", SimpleTypeRef.classType("java.lang.String")),
                component("tags", SimpleTypeRef.struct("Tags")
                        .member("values", SimpleTypeRef.classType("java.lang.StringBuilder"))));
        RecordUnit custom = unit("com.example.Custom",
                new TypeShape(TypeCategory.RECORD, "com.example.Custom", Set.of(),
                        List.of(MethodShape.valueEquals("com.example.Custom"))),
                component("raw", SimpleTypeRef.object()));
        StubRecordSource source = new StubRecordSource(List.of(order, customer, custom));
        RecordAnalysisService service = new RecordAnalysisService(source, checker);

        // Act
        AnalysisResult result = service.analyze(new AnalysisRequest(Path.of("src"), true, false, List.of("gen")));

        // Assert
        assertEquals(3, result.findings().size());
        assertEquals(1, result.nestedCount());
        assertEquals(2, result.stats().unitsChecked());
        assertEquals(1, result.stats().unitsSkipped());
        assertEquals(5, result.stats().componentsChecked());
        assertEquals(4, result.stats().filesAnalyzed());
        assertEquals(1, result.stats().filesFailed());

        assertEquals(Path.of("src"), source.requestedPath);
        assertTrue(source.requestedOptions.includeTests());
        assertFalse(source.requestedOptions.includeAnnotatedClasses());
        assertEquals(List.of("gen"), source.requestedOptions.excludePatterns());
    }

    @Test
    void analyze_ShouldReturnNoFindingsForEmptySource() {
        RecordAnalysisService service = new RecordAnalysisService(new StubRecordSource(List.of()), checker);

        AnalysisResult result = service.analyze(AnalysisRequest.forPath(Path.of("empty")));

        assertFalse(result.hasFindings());
        assertEquals(0, result.stats().unitsChecked());
    }

    private static RecordUnit unit(String name, TypeShape shape, RecordUnit.Component... components) {
        return new RecordUnit(name, shape, List.of(components), Location.unknown(name + ".java"));
    }

    private static RecordUnit.Component component(String name, TypeRef type) {
        return new RecordUnit.Component(name, type, type.displayName(), Location.unknown("Test.java"));
    }

    private static final class StubRecordSource implements RecordSource {

        private final List<RecordUnit> units;
        private Path requestedPath;
        private ParsingOptions requestedOptions;

        private StubRecordSource(List<RecordUnit> units) {
            this.units = new ArrayList<>(units);
        }

        @Override
        public ParsingResult parse(Path sourcePath, ParsingOptions options) {
            this.requestedPath = sourcePath;
            this.requestedOptions = options;
            return new ParsingResult(units, new ParsingStats(4, 1, units.size(), 0, 3));
        }
    }
}
