package com.example.academics.engine;

import com.example.academics.engine.model.GradeBand;
import com.example.academics.engine.model.GradingSystem;

import java.util.List;

/**
 * Grading systems shipped with the application. Configuration can add systems or replace one by code.
 */
public final class DefaultGradingSystems {

    public static final String CBC = "CBC";
    public static final String CBC_DETAILED = "CBC_DETAILED";
    public static final String PERCENTAGE = "PERCENTAGE";
    public static final String LETTER = "LETTER";

    private DefaultGradingSystems() {
    }

    public static GradingSystem cbc() {
        return new GradingSystem(CBC, "CBC (Competency Based Curriculum)", 40.0, List.of(
                new GradeBand(75, "E.E", "Exceeding Expectations", 4),
                new GradeBand(50, "M.E", "Meeting Expectations", 3),
                new GradeBand(30, "A.E", "Approaching Expectations", 2),
                new GradeBand(0, "B.E", "Below Expectations", 1)));
    }

    // eight-level rubric used on report cards
    public static GradingSystem cbcDetailed() {
        return new GradingSystem(CBC_DETAILED, "CBC detailed rubric", 31.0, List.of(
                new GradeBand(90, "EE1", "Exceeding Expectation 1", 4.0),
                new GradeBand(75, "EE2", "Exceeding Expectation 2", 3.5),
                new GradeBand(58, "ME1", "Meeting Expectation 1", 3.0),
                new GradeBand(41, "ME2", "Meeting Expectation 2", 2.5),
                new GradeBand(31, "AE1", "Approaching Expectation 1", 2.0),
                new GradeBand(21, "AE2", "Approaching Expectation 2", 1.5),
                new GradeBand(11, "BE1", "Below Expectation 1", 1.0),
                new GradeBand(0, "BE2", "Below Expectation 2", 0.5)));
    }

    public static GradingSystem percentage() {
        return new GradingSystem(PERCENTAGE, "Percentage System", 50.0, List.of(
                new GradeBand(90, "A", "Excellent", 5),
                new GradeBand(80, "B", "Very Good", 4),
                new GradeBand(70, "C", "Good", 3),
                new GradeBand(60, "D", "Satisfactory", 2),
                new GradeBand(0, "E", "Needs Improvement", 1)));
    }

    public static GradingSystem letter() {
        return new GradingSystem(LETTER, "Letter Grades", 45.0, List.of(
                new GradeBand(95, "A+", "Outstanding", 5),
                new GradeBand(85, "A", "Excellent", 4.5),
                new GradeBand(75, "B+", "Very Good", 4),
                new GradeBand(65, "B", "Good", 3.5),
                new GradeBand(55, "C+", "Above Average", 3),
                new GradeBand(45, "C", "Average", 2.5),
                new GradeBand(35, "D", "Below Average", 2),
                new GradeBand(0, "F", "Fail", 1)));
    }

    public static List<GradingSystem> all() {
        return List.of(cbc(), cbcDetailed(), percentage(), letter());
    }
}
