package org.dxworks.catframe.analyzer;

import org.dxworks.catframe.model.CatDefinition;
import org.dxworks.catframe.model.CatFileAnalysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-file name analysis: scrub, normalize, fold bindings, then extract references.
 * Never fails on malformed text; anything that is not a recognized statement is skipped.
 */
public final class CatFileParser {

    private CatFileParser() {}

    public static CatFileAnalysis parse(String fileName, String sourceCode) {
        String scrubbed = CatScrubber.scrub(sourceCode);
        List<String> lines = CatLineNormalizer.normalize(scrubbed);
        BindingFolder.Result folded = BindingFolder.fold(lines, fileName);

        CatFileAnalysis analysis = new CatFileAnalysis();
        analysis.fileName = fileName;
        analysis.includes = NameLists.uniqueInOrder(folded.includes);
        analysis.shownNames = NameLists.uniqueInOrder(folded.shownNames);
        analysis.definitions = new ArrayList<>(folded.definitions);

        List<String> defined = new ArrayList<>();
        List<String> macros = new ArrayList<>();
        List<String> referenced = new ArrayList<>();
        for (CatDefinition definition : folded.definitions) {
            defined.add(definition.name);
            if (definition.isMacro) {
                macros.add(definition.name);
            }
            referenced.addAll(IdentifierExtractor.references(definition));
        }
        analysis.definedNames = NameLists.uniqueInOrder(defined);
        analysis.macroNames = NameLists.uniqueInOrder(macros);
        analysis.referencedNames = NameLists.uniqueInOrder(referenced);

        return analysis;
    }
}
