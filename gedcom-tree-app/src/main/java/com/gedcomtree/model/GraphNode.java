package com.gedcomtree.model;

import java.util.List;

/**
 * Layout node for one individual. The descriptive fields are copied once from
 * the individual; x, y and generation are written by the layout stages.
 */
public class GraphNode {

    private final String id;
    private final String name;
    private final String sex;
    private final LifeEvent birth;
    private final LifeEvent death;
    private final String lifespan;
    private final String nationality;
    private final String occupation;
    private final List<String> titles;
    private final Individual data;
    private double x;
    private double y;
    private int generation;

    public GraphNode(Individual individual) {
        this.id = individual.getId();
        this.name = individual.displayName();
        this.sex = individual.getSex();
        this.birth = individual.getBirth();
        this.death = individual.getDeath();
        this.lifespan = individual.lifespan();
        this.nationality = individual.getNationality();
        this.occupation = individual.getOccupation();
        this.titles = individual.getTitles();
        this.data = individual;
    }

    // Getters
    public String getId() { return id; }
    public String getName() { return name; }
    public String getSex() { return sex; }
    public LifeEvent getBirth() { return birth; }
    public LifeEvent getDeath() { return death; }
    public String getLifespan() { return lifespan; }
    public String getNationality() { return nationality; }
    public String getOccupation() { return occupation; }
    public List<String> getTitles() { return titles; }
    public List<String> getAlternateNames() { return data.alternateNames(); }
    public Individual getData() { return data; }
    public double getX() { return x; }
    public double getY() { return y; }
    public int getGeneration() { return generation; }

    // Layout setters
    public void setX(double x) { this.x = x; }
    public void setY(double y) { this.y = y; }
    public void setGeneration(int generation) { this.generation = generation; }
}
