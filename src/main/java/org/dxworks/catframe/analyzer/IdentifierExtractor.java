package org.dxworks.catframe.analyzer;

import org.dxworks.catframe.model.CatDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical reference extraction from binding bodies.
 * <p>
 * Every identifier-shaped token counts unless it is the binding's own name, a keyword, a builtin
 * or a literal tag. No grammar is applied, so a token in another syntactic role (a macro
 * parameter, for instance) is still reported.
 */
public final class IdentifierExtractor {

    private IdentifierExtractor() {}

    public static List<String> references(CatDefinition definition) {
        List<String> refs = new ArrayList<>();
        for (String token : CatVocabulary.tokenize(definition.body)) {
            if (isReference(token, definition.name)) {
                refs.add(token);
            }
        }
        return refs;
    }

    static boolean isReference(String token, String ownName) {
        if (token.equals(ownName)) return false; // recursion is not an external reference
        if (CatVocabulary.isKeyword(token)) return false;
        if (CatVocabulary.isBuiltin(token)) return false;
        return !CatVocabulary.isLiteralTag(token);
    }
}
