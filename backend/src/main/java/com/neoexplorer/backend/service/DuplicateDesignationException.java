package com.neoexplorer.backend.service;

public class DuplicateDesignationException extends IllegalArgumentException {

    private final String designation;

    public DuplicateDesignationException(String designation) {
        super("duplicate primary designation: " + designation);
        this.designation = designation;
    }

    public String getDesignation() {
        return designation;
    }
}
