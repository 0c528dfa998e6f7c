package org.dxworks.catframe.model;

public class CatDefinition {
    public String name;
    public boolean isMacro; // header carried a parenthesized parameter list
    public String body; // newline-joined right-hand side, trimmed
    public String fileName;

    public CatDefinition() {
    }

    public CatDefinition(String name, boolean isMacro, String body, String fileName) {
        this.name = name;
        this.isMacro = isMacro;
        this.body = body;
        this.fileName = fileName;
    }
}
