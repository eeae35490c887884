package com.example.academics.enums;

/**
 * Staff roles. CLASS_TEACHER sees reports of the classes they run, HEADTEACHER sees grade-level reports.
 */
public enum UserRole {
    TEACHER,
    CLASS_TEACHER,
    HEADTEACHER
}
