package com.gedcomtree.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An INDI record. The id is fixed at construction; everything else is filled in
 * line by line while the record is open.
 */
public class Individual {

    private final String id;
    private final List<Name> names = new ArrayList<>();
    private String sex = "";
    private LifeEvent birth;
    private LifeEvent death;
    private String occupation = "";
    private String nationality = "";
    private final List<String> titles = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();
    private String familyChild;
    private final List<String> familySpouse = new ArrayList<>();

    public Individual(String id) {
        this.id = id;
    }

    /**
     * Name shown for this person: the primary name's full form, then its given
     * name, then "Unknown".
     */
    public String displayName() {
        if (names.isEmpty()) {
            return "Unknown";
        }
        Name primary = names.get(0);
        if (primary.full() != null && !primary.full().isEmpty()) {
            return primary.full();
        }
        if (primary.given() != null && !primary.given().isEmpty()) {
            return primary.given();
        }
        return "Unknown";
    }

    /**
     * Full forms of every name after the primary one, in document order.
     */
    public List<String> alternateNames() {
        if (names.size() <= 1) {
            return List.of();
        }
        return names.subList(1, names.size()).stream()
                .map(Name::full)
                .toList();
    }

    public String lifespan() {
        String birthDate = birth != null ? birth.getDate() : "";
        String deathDate = death != null ? death.getDate() : "";
        if (birthDate.isEmpty() && deathDate.isEmpty()) {
            return "";
        }
        return (birthDate.isEmpty() ? "?" : birthDate) + " - " + deathDate;
    }

    // Getters
    public String getId() { return id; }
    public List<Name> getNames() { return names; }
    public String getSex() { return sex; }
    public LifeEvent getBirth() { return birth; }
    public LifeEvent getDeath() { return death; }
    public String getOccupation() { return occupation; }
    public String getNationality() { return nationality; }
    public List<String> getTitles() { return titles; }
    public List<String> getNotes() { return notes; }
    public String getFamilyChild() { return familyChild; }
    public List<String> getFamilySpouse() { return familySpouse; }

    // Mutators used while the record is being built
    public void addName(Name name) { names.add(name); }
    public void setSex(String sex) { this.sex = sex; }
    public void setBirth(LifeEvent birth) { this.birth = birth; }
    public void setDeath(LifeEvent death) { this.death = death; }
    public void setOccupation(String occupation) { this.occupation = occupation; }
    public void setNationality(String nationality) { this.nationality = nationality; }
    public void addTitle(String title) { titles.add(title); }
    public void addNote(String note) { notes.add(note); }
    public void setFamilyChild(String familyChild) { this.familyChild = familyChild; }
    public void addFamilySpouse(String familyId) { familySpouse.add(familyId); }
}
