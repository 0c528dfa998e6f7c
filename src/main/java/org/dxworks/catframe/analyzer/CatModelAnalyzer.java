package org.dxworks.catframe.analyzer;

import org.dxworks.catframe.model.CatDefinition;
import org.dxworks.catframe.model.CatFileAnalysis;
import org.dxworks.catframe.model.CatModelAnalysis;
import org.dxworks.catframe.model.CatModelReport;
import org.dxworks.catframe.model.RelationDefinition;
import org.dxworks.catframe.source.SourceFile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Whole-model name resolution over a set of named cat files.
 * <p>
 * Names resolve against the union of every supplied file. Include edges are only checked for
 * presence of the target file, so a file that uses a name without including its defining file
 * still counts as resolved.
 */
public final class CatModelAnalyzer {

    private static final Comparator<RelationDefinition> BY_NAME_THEN_FILE =
            Comparator.comparing((RelationDefinition d) -> d.name)
                    .thenComparing(d -> d.fileName);

    private CatModelAnalyzer() {}

    /**
     * Analyzes files in list order. A later file with an already seen name replaces the earlier
     * text but keeps the earlier position.
     */
    public static CatModelReport analyze(List<SourceFile> files) {
        Objects.requireNonNull(files, "files");
        Map<String, String> textByName = new LinkedHashMap<>();
        for (SourceFile file : files) {
            textByName.put(file.getName(), file.getText());
        }
        return analyze(textByName);
    }

    /**
     * Analyzes files in the iteration order of {@code textByName}.
     */
    public static CatModelReport analyze(Map<String, String> textByName) {
        Objects.requireNonNull(textByName, "textByName");

        List<CatFileAnalysis> parsed = new ArrayList<>();
        for (Map.Entry<String, String> entry : textByName.entrySet()) {
            parsed.add(CatFileParser.parse(entry.getKey(), entry.getValue()));
        }

        CatModelAnalysis analysis = new CatModelAnalysis();
        analysis.includes = collect(parsed, f -> f.includes);
        analysis.definedNames = collect(parsed, f -> f.definedNames);
        analysis.macroNames = collect(parsed, f -> f.macroNames);
        analysis.referencedNames = collect(parsed, f -> f.referencedNames);
        analysis.shownNames = NameLists.sorted(collect(parsed, f -> f.shownNames));

        Set<String> supplied = textByName.keySet();
        analysis.missingIncludes = analysis.includes.stream()
                .filter(include -> !supplied.contains(include))
                .collect(Collectors.toList());

        Set<String> defined = new HashSet<>(analysis.definedNames);
        analysis.unresolvedNames = NameLists.sorted(analysis.referencedNames.stream()
                .filter(name -> !defined.contains(name))
                .filter(name -> !CatVocabulary.isBuiltin(name))
                .collect(Collectors.toList()));

        CatModelReport report = new CatModelReport();
        report.analysis = analysis;
        report.files = parsed;
        report.nonMacroDefined = nonMacroDefined(analysis);
        report.nonMacroDefinitions = nonMacroDefinitions(parsed);
        return report;
    }

    private static List<String> collect(List<CatFileAnalysis> parsed, Function<CatFileAnalysis, List<String>> field) {
        List<String> all = new ArrayList<>();
        for (CatFileAnalysis file : parsed) {
            all.addAll(field.apply(file));
        }
        return NameLists.uniqueInOrder(all);
    }

    // A name declared as a macro anywhere is excluded, even if it is also bound plainly elsewhere.
    private static List<String> nonMacroDefined(CatModelAnalysis analysis) {
        Set<String> macros = new HashSet<>(analysis.macroNames);
        return NameLists.sorted(analysis.definedNames.stream()
                .filter(name -> !macros.contains(name))
                .collect(Collectors.toList()));
    }

    private static List<RelationDefinition> nonMacroDefinitions(List<CatFileAnalysis> parsed) {
        List<RelationDefinition> out = new ArrayList<>();
        for (CatFileAnalysis file : parsed) {
            for (CatDefinition definition : file.definitions) {
                if (!definition.isMacro) {
                    out.add(new RelationDefinition(definition.name, definition.fileName, definition.body));
                }
            }
        }
        out.sort(BY_NAME_THEN_FILE);
        return out;
    }
}
