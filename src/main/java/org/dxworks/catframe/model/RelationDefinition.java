package org.dxworks.catframe.model;

public class RelationDefinition {
    public String name;
    public String fileName;
    public String body;

    public RelationDefinition() {
    }

    public RelationDefinition(String name, String fileName, String body) {
        this.name = name;
        this.fileName = fileName;
        this.body = body;
    }
}
