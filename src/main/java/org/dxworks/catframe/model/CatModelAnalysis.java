package org.dxworks.catframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Whole-model view over every supplied file.
 * Lists keep first-occurrence order except {@link #unresolvedNames} and {@link #shownNames}, which are sorted.
 */
public class CatModelAnalysis {
    public List<String> includes = new ArrayList<>();
    public List<String> missingIncludes = new ArrayList<>();
    public List<String> definedNames = new ArrayList<>();
    public List<String> macroNames = new ArrayList<>();
    public List<String> referencedNames = new ArrayList<>();
    public List<String> unresolvedNames = new ArrayList<>();
    public List<String> shownNames = new ArrayList<>();
}
