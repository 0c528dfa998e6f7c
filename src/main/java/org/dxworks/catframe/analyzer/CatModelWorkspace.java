package org.dxworks.catframe.analyzer;

import org.dxworks.catframe.model.CatDefinition;
import org.dxworks.catframe.model.CatFileAnalysis;
import org.dxworks.catframe.model.CatModelAnalysis;
import org.dxworks.catframe.model.CatModelReport;
import org.dxworks.catframe.model.RelationDefinition;
import org.dxworks.catframe.source.SourceFile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of loaded cat files together with their analysis.
 * Every change returns a new workspace whose report is recomputed from scratch.
 * The report's lists are unmodifiable, and {@link #report()} returns a fresh copy on each call.
 */
public final class CatModelWorkspace {

    public static final List<String> DEFAULT_RELATION_TYPES = List.of("rf", "co", "fr", "po", "ad", "cd", "dd");

    private static final CatModelWorkspace EMPTY = new CatModelWorkspace(new LinkedHashMap<>());

    private final Map<String, String> textByName;
    private final CatModelReport report;

    private CatModelWorkspace(LinkedHashMap<String, String> textByName) {
        this.textByName = Collections.unmodifiableMap(textByName);
        this.report = freeze(CatModelAnalyzer.analyze(this.textByName));
    }

    public static CatModelWorkspace empty() {
        return EMPTY;
    }

    /**
     * Adds the given files. A file whose name is already loaded replaces that file's text.
     */
    public CatModelWorkspace withFiles(Collection<SourceFile> files) {
        Objects.requireNonNull(files, "files");
        if (files.isEmpty()) {
            return this;
        }
        LinkedHashMap<String, String> next = new LinkedHashMap<>(textByName);
        for (SourceFile file : files) {
            next.put(file.getName(), file.getText());
        }
        return new CatModelWorkspace(next);
    }

    public CatModelWorkspace withoutFile(String fileName) {
        if (!textByName.containsKey(fileName)) {
            return this;
        }
        LinkedHashMap<String, String> next = new LinkedHashMap<>(textByName);
        next.remove(fileName);
        return new CatModelWorkspace(next);
    }

    public CatModelReport report() {
        return freeze(report);
    }

    public Map<String, String> textByName() {
        return textByName;
    }

    public List<String> fileNames() {
        List<String> names = new ArrayList<>(textByName.keySet());
        names.sort(null);
        return names;
    }

    /**
     * Relation types offered for edges: the defaults, then every plainly bound name of the model.
     */
    public List<String> relationVocabulary() {
        List<String> all = new ArrayList<>(DEFAULT_RELATION_TYPES);
        all.addAll(report.nonMacroDefined);
        return NameLists.uniqueInOrder(all);
    }

    private static CatModelReport freeze(CatModelReport source) {
        CatModelReport copy = new CatModelReport();
        copy.analysis = freeze(source.analysis);
        copy.nonMacroDefined = List.copyOf(source.nonMacroDefined);
        copy.nonMacroDefinitions = source.nonMacroDefinitions.stream()
                .map(d -> new RelationDefinition(d.name, d.fileName, d.body))
                .toList();
        copy.files = source.files.stream()
                .map(CatModelWorkspace::freeze)
                .toList();
        return copy;
    }

    private static CatModelAnalysis freeze(CatModelAnalysis source) {
        CatModelAnalysis copy = new CatModelAnalysis();
        copy.includes = List.copyOf(source.includes);
        copy.missingIncludes = List.copyOf(source.missingIncludes);
        copy.definedNames = List.copyOf(source.definedNames);
        copy.macroNames = List.copyOf(source.macroNames);
        copy.referencedNames = List.copyOf(source.referencedNames);
        copy.unresolvedNames = List.copyOf(source.unresolvedNames);
        copy.shownNames = List.copyOf(source.shownNames);
        return copy;
    }

    private static CatFileAnalysis freeze(CatFileAnalysis source) {
        CatFileAnalysis copy = new CatFileAnalysis();
        copy.fileName = source.fileName;
        copy.includes = List.copyOf(source.includes);
        copy.definedNames = List.copyOf(source.definedNames);
        copy.macroNames = List.copyOf(source.macroNames);
        copy.referencedNames = List.copyOf(source.referencedNames);
        copy.shownNames = List.copyOf(source.shownNames);
        copy.definitions = source.definitions.stream()
                .map(d -> new CatDefinition(d.name, d.isMacro, d.body, d.fileName))
                .toList();
        return copy;
    }
}
