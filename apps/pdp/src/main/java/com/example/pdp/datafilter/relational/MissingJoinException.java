package com.example.pdp.datafilter.relational;

import com.example.pdp.datafilter.DataFilterException;

import java.util.List;

/**
 * Raised when mapped columns live in tables that have no declared join.
 * Lists every missing table at once.
 */
public class MissingJoinException extends DataFilterException {

    private final List<String> missingTables;

    public MissingJoinException(List<String> missingTables) {
        super("MISSING_JOIN", "No join declared for tables: " + missingTables);
        this.missingTables = List.copyOf(missingTables);
    }

    public List<String> getMissingTables() {
        return missingTables;
    }
}
