package com.example.academics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application settings under the {@code academics} prefix.
 */
@Data
@ConfigurationProperties(prefix = "academics")
public class AcademicsProperties {

    private Grading grading = new Grading();

    private Scale scale = new Scale();

    /** Terms marks may be entered for. */
    private List<String> terms = new ArrayList<>(List.of("Term 1", "Term 2", "Term 3"));

    /** Assessment types marks may be entered for. */
    private List<String> assessmentTypes = new ArrayList<>(List.of("End Term", "Mid Term", "CAT 1", "CAT 2"));

    /** Upper limit for the maximum raw mark of any entered mark. */
    private double maxRawScoreLimit = 1000;

    /** How many students the grade report lists as top performers (ties at the cut-off included). */
    private int topPerformers = 5;

    public boolean isKnownTerm(String term) {
        return term != null && terms.contains(term);
    }

    public boolean isKnownAssessmentType(String assessmentType) {
        return assessmentType != null && assessmentTypes.contains(assessmentType);
    }

    @Data
    public static class Grading {

        /** Code of the grading system overall and subject grades are reported in. */
        private String activeSystem = "CBC";

        /** Extra systems, or replacements for a built-in system with the same code. */
        private List<SystemConfig> systems = new ArrayList<>();
    }

    @Data
    public static class SystemConfig {
        private String code;
        private String name;
        private double passMark = 50;
        private List<BandConfig> bands = new ArrayList<>();
    }

    @Data
    public static class BandConfig {
        private double min;
        private String label;
        private String description;
        private double points;
    }

    @Data
    public static class Scale {

        /** Marks per subject that totals are reported on. */
        private double defaultSubjectMax = 100;

        /** assessment type -> marks per subject, overriding the default. */
        private Map<String, Double> assessments = new LinkedHashMap<>();
    }
}
