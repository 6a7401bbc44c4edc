package com.gedcomtree.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A FAM record. Husband and wife are plain individual ids; nothing checks them
 * against the referenced person's sex.
 */
public class Family {

    private final String id;
    private String husband;
    private String wife;
    private final List<String> children = new ArrayList<>();
    private LifeEvent marriage;
    private LifeEvent divorce;

    public Family(String id) {
        this.id = id;
    }

    public String getId() { return id; }
    public String getHusband() { return husband; }
    public String getWife() { return wife; }
    public List<String> getChildren() { return children; }
    public LifeEvent getMarriage() { return marriage; }
    public LifeEvent getDivorce() { return divorce; }

    public void setHusband(String husband) { this.husband = husband; }
    public void setWife(String wife) { this.wife = wife; }
    public void addChild(String childId) { children.add(childId); }
    public void setMarriage(LifeEvent marriage) { this.marriage = marriage; }
    public void setDivorce(LifeEvent divorce) { this.divorce = divorce; }
}
