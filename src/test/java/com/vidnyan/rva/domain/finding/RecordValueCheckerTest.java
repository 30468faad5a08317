package com.vidnyan.rva.domain.finding;

import com.vidnyan.rva.domain.model.Location;
import com.vidnyan.rva.domain.model.MethodShape;
import com.vidnyan.rva.domain.model.SimpleTypeRef;
import com.vidnyan.rva.domain.model.TypeCategory;
import com.vidnyan.rva.domain.model.TypeRef;
import com.vidnyan.rva.domain.model.TypeShape;
import com.vidnyan.rva.domain.semantics.KindResolver;
import com.vidnyan.rva.domain.semantics.ValueSemanticsClassifier;
import com.vidnyan.rva.domain.semantics.Verdict;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecordValueCheckerTest {

    private static final String FILE = "src/main/java/com/example/Order.java";
    private static final String ORDER = "com.example.Order";

    private final KindResolver kindResolver = new KindResolver();
    private final RecordValueChecker checker =
            new RecordValueChecker(new ValueSemanticsClassifier(kindResolver), kindResolver);

    @Test
    void check_ShouldReportDirectFailure() {
        RecordUnit unit = record(ORDER,
                component("id", SimpleTypeRef.primitive("long"), 3),
                component("payload", SimpleTypeRef.array(SimpleTypeRef.primitive("byte")), 4));

        List<Finding> findings = checker.check(unit);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals("RVA01", finding.diagnosticId());
        assertEquals(ORDER, finding.recordName());
        assertEquals("payload", finding.memberName());
        assertEquals("byte[]", finding.memberType());
        assertEquals(Verdict.failed(), finding.verdict());
        assertEquals("Member 'byte[] payload' does not have value semantics", finding.message());
        assertEquals(Location.at(FILE, 4, 5), finding.location());
        assertFalse(finding.isNested());
    }

    @Test
    void check_ShouldNameInnerTypeForNestedFailure() {
        SimpleTypeRef address = SimpleTypeRef.struct("Address")
                .member("street", SimpleTypeRef.classType("java.lang.String"))
                .member("lines", SimpleTypeRef.classType("java.lang.StringBuilder"));
        RecordUnit unit = record(ORDER, component("shipTo", address, 5));

        List<Finding> findings = checker.check(unit);

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).isNested());
        assertEquals("Member 'Address shipTo (field java.lang.StringBuilder)' does not have value semantics",
                findings.get(0).message());
    }

    @Test
    void check_ShouldReportEveryFailingComponent() {
        RecordUnit unit = record(ORDER,
                component("owner", SimpleTypeRef.object(), 3),
                component("status", SimpleTypeRef.enumType("com.example.Status"), 4),
                component("value", SimpleTypeRef.typeParameter("T"), 5));

        List<Finding> findings = checker.check(unit);

        assertEquals(List.of("owner", "value"), findings.stream().map(Finding::memberName).toList());
    }

    @Test
    void check_ShouldSkipUnitDeclaringOwnEquals() {
        TypeShape shape = new TypeShape(TypeCategory.RECORD, ORDER, Set.of(),
                List.of(MethodShape.identityEqualsOverride(ORDER, "java.lang.Object")));
        RecordUnit unit = new RecordUnit(ORDER, shape,
                List.of(component("payload", SimpleTypeRef.array(SimpleTypeRef.primitive("byte")), 4)),
                Location.at(FILE, 2, 1));

        assertTrue(checker.declaresOwnEquality(unit));
        assertTrue(checker.check(unit).isEmpty());
    }

    @Test
    void check_ShouldSkipUnresolvedComponents() {
        RecordUnit unit = record(ORDER,
                new RecordUnit.Component("missing", null, "com.unknown.Type", Location.at(FILE, 3, 5)),
                component("ok", SimpleTypeRef.classType("java.lang.String"), 4));

        assertTrue(checker.check(unit).isEmpty());
    }

    @Test
    void check_ShouldPassOptionalOfValueType() {
        RecordUnit unit = record(ORDER,
                component("discount", SimpleTypeRef.nullable(SimpleTypeRef.classType("java.lang.Integer")), 3));

        assertTrue(checker.check(unit).isEmpty());
    }

    private static RecordUnit record(String name, RecordUnit.Component... components) {
        return new RecordUnit(name, TypeShape.of(TypeCategory.RECORD, name), List.of(components),
                Location.at(FILE, 2, 1));
    }

    private static RecordUnit.Component component(String name, TypeRef type, int line) {
        return new RecordUnit.Component(name, type, type.displayName(), Location.at(FILE, line, 5));
    }
}
