package com.example.academics.engine.model;

import java.util.List;
import java.util.Locale;

/**
 * CBC education levels. Subjects are offered per level and every grade name maps to exactly one level.
 */
public enum EducationLevel {
    LOWER_PRIMARY(List.of("PP1", "PP2", "Grade 1", "Grade 2", "Grade 3")),
    UPPER_PRIMARY(List.of("Grade 4", "Grade 5", "Grade 6")),
    JUNIOR_SECONDARY(List.of("Grade 7", "Grade 8", "Grade 9"));

    private final List<String> grades;

    EducationLevel(List<String> grades) {
        this.grades = grades;
    }

    public List<String> getGrades() {
        return grades;
    }

    /**
     * Resolve a grade name ("Grade 7", "grade 7", "PP1") to its level.
     *
     * @throws IllegalArgumentException when the grade is not part of any level
     */
    public static EducationLevel forGrade(String gradeName) {
        if (gradeName == null || gradeName.isBlank()) {
            throw new IllegalArgumentException("grade name required");
        }
        String wanted = gradeName.trim().toLowerCase(Locale.ROOT);
        for (EducationLevel level : values()) {
            for (String g : level.grades) {
                if (g.toLowerCase(Locale.ROOT).equals(wanted)) {
                    return level;
                }
            }
        }
        throw new IllegalArgumentException("Unknown grade: " + gradeName);
    }
}
