package org.dxworks.catframe.analyzer;

import org.dxworks.catframe.model.CatDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifierExtractorTest {

    private static List<String> refs(String name, String body) {
        return IdentifierExtractor.references(new CatDefinition(name, false, body, "m.cat"));
    }

    @Test
    void selfReferenceIsNotExternal() {
        assertEquals(List.of(), refs("a", "a | po"));
    }

    @Test
    void builtinsAndKeywordsAreSkipped() {
        assertEquals(List.of("co-x"), refs("a", "rf | rfe | po-loc ; fencerel(F) | co-x"));
        assertEquals(List.of("matched"), refs("a", "let rec matched with"));
    }

    @Test
    void mixedCaseTagsAreReportedButUpperCaseTagsAreNot() {
        assertEquals(List.of("Acquire", "Before-atomic"),
                refs("a", "[RMW] ; po ; [W] ; [Acquire] ; fencerel(Before-atomic)"));
    }

    @Test
    void upperCaseUserBindingsAreNeverReported() {
        assertEquals(List.of(), refs("x", "[UL] ; UNMATCHED-LKW"));
    }

    @Test
    void macroParametersAreReportedAsReferences() {
        CatDefinition macro = new CatDefinition("fence", true, "[r] ; fencerel(F) ; [r]", "m.cat");

        assertEquals(List.of("r", "r"), IdentifierExtractor.references(macro));
    }

    @Test
    void dottedAndHyphenatedNamesStayWhole() {
        assertEquals(List.of("x.y", "a-b"), refs("z", "x.y | a-b | 0"));
    }
}
