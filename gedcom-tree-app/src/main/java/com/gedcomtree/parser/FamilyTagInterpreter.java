package com.gedcomtree.parser;

import com.gedcomtree.model.Family;
import com.gedcomtree.model.LifeEvent;

/**
 * Applies one subordinate line of a FAM record.
 */
final class FamilyTagInterpreter {

    private FamilyTagInterpreter() {
    }

    static void apply(Family family, String tag, String value, String parentTag) {
        switch (tag) {
            case "HUSB" -> family.setHusband(value);
            case "WIFE" -> family.setWife(value);
            case "CHIL" -> family.addChild(value);
            case "MARR" -> family.setMarriage(new LifeEvent());
            case "DIV" -> family.setDivorce(new LifeEvent());
            case "DATE" -> {
                LifeEvent event = enclosingEvent(family, parentTag);
                if (event != null) event.setDate(value);
            }
            case "PLAC" -> {
                LifeEvent event = enclosingEvent(family, parentTag);
                if (event != null) event.setPlace(value);
            }
            default -> {
                // unsupported tag
            }
        }
    }

    private static LifeEvent enclosingEvent(Family family, String parentTag) {
        if ("MARR".equals(parentTag)) {
            return family.getMarriage();
        }
        if ("DIV".equals(parentTag)) {
            return family.getDivorce();
        }
        return null;
    }
}
