package com.example.academics.engine.port;

import com.example.academics.engine.model.RawMark;

import java.util.Collection;
import java.util.List;

/**
 * Supplies the raw marks of a set of students for one term and assessment type.
 */
public interface MarkSource {

    List<RawMark> fetchMarks(Collection<Long> studentIds, String term, String assessmentType);
}
