package com.example.academics.engine.port;

import com.example.academics.engine.model.EducationLevel;
import com.example.academics.engine.model.Subject;

import java.util.List;

/**
 * Subject structure: composite flags, components, weights and scales.
 */
public interface SubjectCatalog {

    /** Subjects offered at the level, in report column order. */
    List<Subject> subjectsFor(EducationLevel level);

    List<Subject> allSubjects();
}
