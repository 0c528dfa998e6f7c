package org.dxworks.catframe.model;

import java.util.ArrayList;
import java.util.List;

public class CatFileAnalysis {
    public String kind = "file";
    public String fileName;
    public List<String> includes = new ArrayList<>();
    public List<String> definedNames = new ArrayList<>();
    public List<String> macroNames = new ArrayList<>();
    public List<String> referencedNames = new ArrayList<>();
    public List<String> shownNames = new ArrayList<>();
    public List<CatDefinition> definitions = new ArrayList<>();
}
