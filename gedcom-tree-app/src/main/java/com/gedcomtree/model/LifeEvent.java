package com.gedcomtree.model;

/**
 * A dated event (birth, death, marriage, divorce). Opened empty by its tag and
 * filled in by the DATE/PLAC/TYPE lines nested under it.
 */
public class LifeEvent {

    private String date = "";
    private String place = "";
    private String type = "";

    public String getDate() { return date; }
    public String getPlace() { return place; }
    public String getType() { return type; }

    public void setDate(String date) { this.date = date; }
    public void setPlace(String place) { this.place = place; }
    public void setType(String type) { this.type = type; }

    public boolean hasDate() {
        return date != null && !date.isEmpty();
    }
}
