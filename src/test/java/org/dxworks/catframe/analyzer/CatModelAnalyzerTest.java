package org.dxworks.catframe.analyzer;

import org.dxworks.catframe.TestUtils;
import org.dxworks.catframe.model.CatModelReport;
import org.dxworks.catframe.model.RelationDefinition;
import org.dxworks.catframe.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CatModelAnalyzerTest {

    private static Map<String, String> files(String... nameTextPairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < nameTextPairs.length; i += 2) {
            map.put(nameTextPairs[i], nameTextPairs[i + 1]);
        }
        return map;
    }

    @Test
    void includeResolvesAgainstSuppliedFileNames() {
        CatModelReport both = CatModelAnalyzer.analyze(files("a", "include \"b\"", "b", "let x = id"));
        CatModelReport onlyA = CatModelAnalyzer.analyze(files("a", "include \"b\""));

        assertEquals(List.of("b"), both.analysis.includes);
        assertEquals(List.of(), both.analysis.missingIncludes);
        assertEquals(List.of("b"), onlyA.analysis.missingIncludes);
    }

    @Test
    void macroAndPlainBindings() {
        CatModelReport report = CatModelAnalyzer.analyze(files("m.cat", "let f(x) = x\nlet y = po"));

        assertTrue(report.analysis.definedNames.containsAll(List.of("f", "y")));
        assertEquals(List.of("f"), report.analysis.macroNames);
        assertEquals(List.of("y"), report.nonMacroDefined);
    }

    @Test
    void onlyUndefinedNonBuiltinNamesAreUnresolved() {
        CatModelReport report = CatModelAnalyzer.analyze(files("m.cat", "let a = b\nlet c = a"));

        assertEquals(List.of("b"), report.analysis.unresolvedNames);
        assertEquals(List.of("b", "a"), report.analysis.referencedNames);
    }

    @Test
    void builtinsNeedNoDefinition() {
        CatModelReport report = CatModelAnalyzer.analyze(files("m.cat", "let com = po | rf | co | fr"));

        assertTrue(report.analysis.unresolvedNames.isEmpty());
        assertTrue(report.analysis.referencedNames.isEmpty());
    }

    @Test
    void namesResolveAcrossFilesWithoutIncludeEdges() {
        CatModelReport report = CatModelAnalyzer.analyze(files("a.cat", "let a = b", "b.cat", "let b = po"));

        assertTrue(report.analysis.unresolvedNames.isEmpty());
        assertTrue(report.analysis.includes.isEmpty());
    }

    @Test
    void unresolvedAndShownNamesAreSorted() {
        CatModelReport report = CatModelAnalyzer.analyze(files(
                "m.cat", "let a = zeta | alpha | mid\nshow z, a",
                "n.cat", "show b"));

        assertEquals(List.of("zeta", "alpha", "mid"), report.analysis.referencedNames);
        assertEquals(List.of("alpha", "mid", "zeta"), report.analysis.unresolvedNames);
        assertEquals(List.of("a", "b", "z"), report.analysis.shownNames);
    }

    @Test
    void mergedNamesKeepFirstOccurrenceOrder() {
        CatModelReport report = CatModelAnalyzer.analyze(files(
                "one.cat", "let b = po\nlet a = po",
                "two.cat", "let a = rf\nlet c = co"));

        assertEquals(List.of("b", "a", "c"), report.analysis.definedNames);
        assertEquals(2, report.files.size());
        assertEquals("one.cat", report.files.get(0).fileName);
    }

    @Test
    void nonMacroDefinitionsAreSortedByNameThenFile() {
        CatModelReport report = CatModelAnalyzer.analyze(files(
                "m.cat", "let b = po\nlet a = rf\nlet f(x) = x",
                "k.cat", "let b = co"));

        List<RelationDefinition> defs = report.nonMacroDefinitions;
        assertEquals(3, defs.size());
        assertEquals(List.of("a", "b", "b"), defs.stream().map(d -> d.name).toList());
        assertEquals(List.of("m.cat", "k.cat", "m.cat"), defs.stream().map(d -> d.fileName).toList());
        assertEquals(List.of("rf", "co", "po"), defs.stream().map(d -> d.body).toList());
    }

    @Test
    void laterDuplicateReplacesTextButKeepsPosition() {
        CatModelReport report = CatModelAnalyzer.analyze(List.of(
                new SourceFile("a.cat", "let x = po"),
                new SourceFile("b.cat", "let y = rf"),
                new SourceFile("a.cat", "let z = co")));

        assertEquals(List.of("z", "y"), report.analysis.definedNames);
        assertEquals(List.of("a.cat", "b.cat"), report.files.stream().map(f -> f.fileName).toList());
    }

    @Test
    void analysisIsIdempotent() {
        Map<String, String> input = files(
                "a.cat", "include \"b.cat\"\nlet a = b | q\nshow a",
                "b.cat", "let rec b = b ; po\nlet f(r) = r");

        String first = TestUtils.toJson(CatModelAnalyzer.analyze(input));
        String second = TestUtils.toJson(CatModelAnalyzer.analyze(input));

        assertEquals(first, second);
    }

    @Test
    void emptyInputGivesEmptyAnalysis() {
        CatModelReport report = CatModelAnalyzer.analyze(Map.of());

        assertTrue(report.analysis.definedNames.isEmpty());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    void rejectsNullInput() {
        assertThrows(NullPointerException.class, () -> CatModelAnalyzer.analyze((Map<String, String>) null));
        assertThrows(NullPointerException.class, () -> CatModelAnalyzer.analyze((List<SourceFile>) null));
    }
}
