package com.mugpunters.backend.model;

/**
 * Letter grade derived from an accuracy score.
 */
public enum PerformanceGrade {
    A, B, C, D, F;

    public static final String NOT_GRADABLE = "N/A";

    public static String label(PerformanceGrade grade) {
        return grade != null ? grade.name() : NOT_GRADABLE;
    }
}
