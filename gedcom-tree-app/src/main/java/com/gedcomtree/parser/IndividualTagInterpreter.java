package com.gedcomtree.parser;

import com.gedcomtree.model.Individual;
import com.gedcomtree.model.LifeEvent;

/**
 * Applies one subordinate line of an INDI record. Tags outside the supported
 * subset are ignored.
 */
final class IndividualTagInterpreter {

    private IndividualTagInterpreter() {
    }

    static void apply(Individual individual, String tag, String value, String parentTag) {
        switch (tag) {
            case "NAME" -> individual.addName(NameParser.parse(value));
            case "SEX" -> individual.setSex(value);
            case "BIRT" -> individual.setBirth(new LifeEvent());
            case "DEAT" -> individual.setDeath(new LifeEvent());
            case "DATE" -> {
                LifeEvent event = enclosingEvent(individual, parentTag);
                if (event != null) event.setDate(value);
            }
            case "PLAC" -> {
                LifeEvent event = enclosingEvent(individual, parentTag);
                if (event != null) event.setPlace(value);
            }
            case "TYPE" -> {
                LifeEvent event = enclosingEvent(individual, parentTag);
                if (event != null) event.setType(value);
            }
            case "OCCU" -> individual.setOccupation(value);
            case "NATI" -> individual.setNationality(value);
            case "TITL" -> individual.addTitle(value);
            case "NOTE" -> individual.addNote(value);
            case "FAMC" -> individual.setFamilyChild(value);
            case "FAMS" -> individual.addFamilySpouse(value);
            default -> {
                // unsupported tag
            }
        }
    }

    private static LifeEvent enclosingEvent(Individual individual, String parentTag) {
        if ("BIRT".equals(parentTag)) {
            return individual.getBirth();
        }
        if ("DEAT".equals(parentTag)) {
            return individual.getDeath();
        }
        return null;
    }
}
