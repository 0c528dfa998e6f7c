package org.dxworks.catframe.analyzer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CatLineNormalizerTest {

    @Test
    void dropsBlankAndHashCommentLinesAcrossLineEndings() {
        String text = "let a = po  \r\n\r\n   \n# note\n  # indented\nlet b = rf\rlet c = co";

        assertEquals(List.of("let a = po", "let b = rf", "let c = co"), CatLineNormalizer.normalize(text));
    }

    @Test
    void keepsLeadingWhitespaceOfContinuationLines() {
        assertEquals(List.of("let a = rf |", "  fr"), CatLineNormalizer.normalize("let a = rf |   \n  fr\t\n"));
    }

    @Test
    void emptyInputHasNoLines() {
        assertTrue(CatLineNormalizer.normalize("").isEmpty());
        assertTrue(CatLineNormalizer.normalize("\n\n  \n").isEmpty());
    }
}
