package com.example.academics.engine;

import com.example.academics.engine.exception.InvalidGradingConfigurationException;
import com.example.academics.engine.exception.InvalidPercentageException;
import com.example.academics.engine.exception.UnknownGradingSystemException;
import com.example.academics.engine.model.GradeAward;
import com.example.academics.engine.model.GradeBand;
import com.example.academics.engine.model.GradingSystem;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts percentages into grade labels and points for any of the registered grading systems.
 * <p>
 * Bands are checked from the highest lower bound down and the first band whose lower bound is
 * at or below the percentage wins, so a boundary value belongs to the higher band
 * (75.0 is E.E under CBC). Which system is "active" is decided by the caller.
 */
public class GradingVocabulary {

    private final Map<String, GradingSystem> systems;

    public GradingVocabulary(Collection<GradingSystem> systems) {
        Map<String, GradingSystem> byCode = new LinkedHashMap<>();
        for (GradingSystem system : systems) {
            if (byCode.putIfAbsent(system.getCode(), system) != null) {
                throw new InvalidGradingConfigurationException("Grading system registered twice: " + system.getCode());
            }
        }
        this.systems = Collections.unmodifiableMap(byCode);
    }

    /**
     * @throws InvalidPercentageException     when percentage is NaN or outside [0, 100]
     * @throws UnknownGradingSystemException  when no system is registered under systemCode
     */
    public GradeAward gradeFor(double percentage, String systemCode) {
        if (Double.isNaN(percentage) || percentage < 0 || percentage > 100) {
            throw new InvalidPercentageException("Percentage outside [0, 100]: " + percentage);
        }
        GradingSystem system = system(systemCode);
        for (GradeBand band : system.getBands()) {
            if (band.getLowerBound() <= percentage) {
                return new GradeAward(band.getLabel(), band.getDescription(), band.getPoints(), system.getCode());
            }
        }
        // unreachable: the lowest band of a GradingSystem always starts at 0
        throw new IllegalStateException("No band of " + systemCode + " covers " + percentage);
    }

    public GradingSystem system(String systemCode) {
        GradingSystem system = systemCode == null ? null : systems.get(systemCode);
        if (system == null) {
            throw new UnknownGradingSystemException("Unknown grading system: " + systemCode);
        }
        return system;
    }

    public Set<String> systemCodes() {
        return systems.keySet();
    }

    public boolean isPass(double percentage, String systemCode) {
        if (Double.isNaN(percentage) || percentage < 0 || percentage > 100) {
            throw new InvalidPercentageException("Percentage outside [0, 100]: " + percentage);
        }
        return percentage >= system(systemCode).getPassMark();
    }

    /** Band labels from the best band to the worst. */
    public List<String> labels(String systemCode) {
        return system(systemCode).getBands().stream()
                .map(GradeBand::getLabel)
                .collect(Collectors.toUnmodifiableList());
    }
}
