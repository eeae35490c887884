package com.example.academics.engine.model;

import lombok.Value;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable index over the raw marks fetched for one run.
 * Every lookup during aggregation goes through the same snapshot, so a report never
 * mixes marks read at different times.
 */
public final class MarkSnapshot {

    private static final MarkSnapshot EMPTY = new MarkSnapshot(Map.of(), 0);

    private final Map<Key, RawMark> marks;
    private final int size;

    private MarkSnapshot(Map<Key, RawMark> marks, int size) {
        this.marks = marks;
        this.size = size;
    }

    public static MarkSnapshot empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException when two marks share student, subject, component, term and assessment
     */
    public static MarkSnapshot of(Collection<RawMark> rawMarks) {
        if (rawMarks == null || rawMarks.isEmpty()) {
            return EMPTY;
        }
        Map<Key, RawMark> index = new HashMap<>();
        for (RawMark m : rawMarks) {
            Key key = new Key(m.getStudentId(), m.getSubjectId(), m.getComponentId(), m.getTerm(), m.getAssessmentType());
            RawMark previous = index.putIfAbsent(key, m);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate mark for " + key);
            }
        }
        return new MarkSnapshot(Map.copyOf(index), index.size());
    }

    public static MarkSnapshot of(RawMark... rawMarks) {
        return of(List.of(rawMarks));
    }

    public Optional<RawMark> find(Long studentId, Long subjectId, Long componentId, String term, String assessmentType) {
        return Optional.ofNullable(marks.get(new Key(studentId, subjectId, componentId, term, assessmentType)));
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @Value
    private static class Key {
        Long studentId;
        Long subjectId;
        Long componentId;
        String term;
        String assessmentType;
    }
}
