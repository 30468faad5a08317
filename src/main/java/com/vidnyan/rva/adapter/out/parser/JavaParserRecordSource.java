package com.vidnyan.rva.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import com.vidnyan.rva.application.port.out.RecordSource;
import com.vidnyan.rva.domain.finding.RecordUnit;
import com.vidnyan.rva.domain.model.Location;
import com.vidnyan.rva.domain.model.TypeRef;
import com.vidnyan.rva.domain.model.TypeShape;
import com.vidnyan.rva.domain.semantics.Kind;
import com.vidnyan.rva.domain.semantics.KindResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * JavaParser adapter with JavaSymbolSolver for type resolution.
 * Collects records and, optionally, classes whose equality is generated from their
 * fields (Lombok {@code @Value}, {@code @Data}, {@code @EqualsAndHashCode}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JavaParserRecordSource implements RecordSource {

    private static final String EQUALS_AND_HASH_CODE = "lombok.EqualsAndHashCode";
    private static final String EXCLUDE = "Exclude";
    private static final String INCLUDE = "Include";

    private final KindResolver kindResolver;

    @Override
    public ParsingResult parse(Path sourcePath, ParsingOptions options) {
        long startTime = System.currentTimeMillis();
        if (!Files.isDirectory(sourcePath)) {
            log.error("Source path is not a directory: {}", sourcePath);
            return new ParsingResult(List.of(), ParsingStats.empty());
        }
        log.info("Parsing source code from: {} (with SymbolSolver)", sourcePath);

        JavaParser parser = createParser(sourcePath);
        List<Path> javaFiles = collectJavaFiles(sourcePath, options);
        log.info("Found {} Java files", javaFiles.size());

        List<RecordUnit> units = new ArrayList<>();
        int filesProcessed = 0;
        int filesFailed = 0;
        int records = 0;
        int classes = 0;

        // sequential: the symbol solver is not thread-safe
        for (Path file : javaFiles) {
            try {
                ParseResult<CompilationUnit> result = parser.parse(file);
                if (!result.isSuccessful() || result.getResult().isEmpty()) {
                    log.warn("Failed to parse {}: {}", file, result.getProblems());
                    filesFailed++;
                    continue;
                }
                CompilationUnit cu = result.getResult().get();
                for (RecordDeclaration record : cu.findAll(RecordDeclaration.class)) {
                    units.add(recordUnit(record, file));
                    records++;
                }
                if (options.includeAnnotatedClasses()) {
                    for (ClassOrInterfaceDeclaration type : cu.findAll(ClassOrInterfaceDeclaration.class)) {
                        if (type.isInterface()) {
                            continue;
                        }
                        TypeShape shape = JavaTypeShapes.ofDeclaration(type);
                        if (kindResolver.kindOf(shape) == Kind.DERIVED_EQUALITY_COMPOSITE) {
                            units.add(classUnit(type, shape, file));
                            classes++;
                        }
                    }
                }
                filesProcessed++;
            } catch (IOException e) {
                log.warn("Failed to read {}: {}", file, e.getMessage());
                filesFailed++;
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Parsing complete: {} files ({} failed), {} records, {} annotated classes in {}ms",
                filesProcessed, filesFailed, records, classes, duration);

        return new ParsingResult(
                List.copyOf(units),
                new ParsingStats(filesProcessed, filesFailed, records, classes, duration));
    }

    private JavaParser createParser(Path sourcePath) {
        CombinedTypeSolver combinedTypeSolver = new CombinedTypeSolver();
        combinedTypeSolver.add(new ReflectionTypeSolver());

        // prefer the enclosing source root so that packages resolve
        Path current = sourcePath.toAbsolutePath().normalize();
        while (current != null) {
            if (current.endsWith(Path.of("src", "main", "java")) || current.endsWith(Path.of("src", "test", "java"))) {
                if (!current.equals(sourcePath.toAbsolutePath().normalize())) {
                    log.info("Auto-detected source root: {}", current);
                    combinedTypeSolver.add(new JavaParserTypeSolver(current));
                }
                break;
            }
            current = current.getParent();
        }
        combinedTypeSolver.add(new JavaParserTypeSolver(sourcePath));

        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setSymbolResolver(new JavaSymbolSolver(combinedTypeSolver));
        return new JavaParser(config);
    }

    private List<Path> collectJavaFiles(Path sourcePath, ParsingOptions options) {
        try (Stream<Path> paths = Files.walk(sourcePath)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".java"))
                    .filter(p -> options.includeTests() || !isTestFile(sourcePath.relativize(p)))
                    .filter(p -> !matchesExcludePattern(p, options.excludePatterns()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Failed to walk directory: {}", sourcePath, e);
            return List.of();
        }
    }

    private boolean isTestFile(Path relativePath) {
        String pathStr = relativePath.toString().replace('\\', '/');
        return pathStr.startsWith("test/") || pathStr.contains("/test/")
                || pathStr.endsWith("Test.java") || pathStr.endsWith("Tests.java");
    }

    private boolean matchesExcludePattern(Path path, List<String> patterns) {
        String pathStr = path.toString();
        return patterns != null && patterns.stream().anyMatch(pathStr::contains);
    }

    private RecordUnit recordUnit(RecordDeclaration record, Path file) {
        List<RecordUnit.Component> components = new ArrayList<>();
        for (Parameter parameter : record.getParameters()) {
            components.add(component(parameter.getNameAsString(), parameter.getType(), parameter, file));
        }
        return new RecordUnit(
                JavaTypeShapes.qualifiedNameOf(record),
                JavaTypeShapes.ofDeclaration(record),
                components,
                locationOf(record, file));
    }

    /**
     * Fields Lombok's generated equals compares: non-static, non-transient fields without
     * {@code @EqualsAndHashCode.Exclude}; with {@code onlyExplicitlyIncluded = true}, only
     * the non-static fields marked {@code @EqualsAndHashCode.Include}.
     */
    private RecordUnit classUnit(TypeDeclaration<?> type, TypeShape shape, Path file) {
        CompilationUnit cu = type.findCompilationUnit().orElse(null);
        boolean explicitOnly = onlyExplicitlyIncluded(type, cu);

        List<RecordUnit.Component> components = new ArrayList<>();
        for (FieldDeclaration field : type.getFields()) {
            if (field.isStatic()) {
                continue;
            }
            boolean included = explicitOnly
                    ? hasLombokMarker(field, INCLUDE, cu)
                    : !field.isTransient() && !hasLombokMarker(field, EXCLUDE, cu);
            if (!included) {
                continue;
            }
            for (VariableDeclarator variable : field.getVariables()) {
                components.add(component(variable.getNameAsString(), variable.getType(), variable, file));
            }
        }
        return new RecordUnit(shape.qualifiedName(), shape, components, locationOf(type, file));
    }

    private boolean onlyExplicitlyIncluded(TypeDeclaration<?> type, CompilationUnit cu) {
        for (AnnotationExpr annotation : type.getAnnotations()) {
            if (!annotation.isNormalAnnotationExpr() || !isEqualsAndHashCode(annotation.getNameAsString(), cu)) {
                continue;
            }
            for (MemberValuePair pair : annotation.asNormalAnnotationExpr().getPairs()) {
                if ("onlyExplicitlyIncluded".equals(pair.getNameAsString())
                        && pair.getValue().isBooleanLiteralExpr()
                        && pair.getValue().asBooleanLiteralExpr().getValue()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Matches {@code @EqualsAndHashCode.Exclude}, {@code @lombok.EqualsAndHashCode.Exclude}
     * and an imported {@code @Exclude}.
     */
    private boolean hasLombokMarker(FieldDeclaration field, String marker, CompilationUnit cu) {
        for (AnnotationExpr annotation : field.getAnnotations()) {
            String name = annotation.getNameAsString();
            if (name.endsWith("." + marker)) {
                if (isEqualsAndHashCode(name.substring(0, name.length() - marker.length() - 1), cu)) {
                    return true;
                }
            } else if (name.equals(marker)
                    && (EQUALS_AND_HASH_CODE + "." + marker).equals(JavaTypeShapes.qualify(name, cu))) {
                return true;
            }
        }
        return false;
    }

    /**
     * An unqualified {@code EqualsAndHashCode} that no import qualifies is taken as Lombok's.
     */
    private boolean isEqualsAndHashCode(String name, CompilationUnit cu) {
        if (EQUALS_AND_HASH_CODE.equals(name)) {
            return true;
        }
        String qualified = JavaTypeShapes.qualifyImported(name, cu);
        return EQUALS_AND_HASH_CODE.equals(qualified)
                || (qualified.equals(name) && EQUALS_AND_HASH_CODE.endsWith("." + name));
    }

    private RecordUnit.Component component(String name, Type type, Node node, Path file) {
        TypeRef resolved = null;
        try {
            resolved = ResolvedTypeRef.of(type.resolve());
        } catch (RuntimeException e) {
            log.debug("Could not resolve type {} of {}: {}", type, name, e.getMessage());
        }
        return new RecordUnit.Component(name, resolved, type.asString(), locationOf(node, file));
    }

    private Location locationOf(Node node, Path file) {
        return node.getBegin()
                .map(position -> Location.at(file.toString(), position.line, position.column))
                .orElse(Location.unknown(file.toString()));
    }
}
