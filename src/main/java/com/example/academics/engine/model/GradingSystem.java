package com.example.academics.engine.model;

import com.example.academics.engine.exception.InvalidGradingConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A named grading vocabulary (CBC, percentage letters, ...).
 * Bands are kept sorted from the highest lower bound to the lowest; the constructor rejects
 * tables that leave any part of [0, 100] without a band.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class GradingSystem {

    private final String code;
    private final String name;
    private final double passMark;
    private final List<GradeBand> bands;

    public GradingSystem(String code, String name, double passMark, List<GradeBand> bands) {
        if (code == null || code.isBlank()) {
            throw new InvalidGradingConfigurationException("Grading system code required");
        }
        if (bands == null || bands.isEmpty()) {
            throw new InvalidGradingConfigurationException("Grading system " + code + " has no bands");
        }
        if (passMark < 0 || passMark > 100) {
            throw new InvalidGradingConfigurationException("Pass mark of " + code + " outside [0, 100]: " + passMark);
        }
        Set<String> labels = new HashSet<>();
        Set<Double> bounds = new HashSet<>();
        for (GradeBand band : bands) {
            if (band.getLabel() == null || band.getLabel().isBlank()) {
                throw new InvalidGradingConfigurationException("Blank band label in " + code);
            }
            if (!labels.add(band.getLabel())) {
                throw new InvalidGradingConfigurationException("Duplicate band label " + band.getLabel() + " in " + code);
            }
            double lb = band.getLowerBound();
            if (Double.isNaN(lb) || lb < 0 || lb > 100) {
                throw new InvalidGradingConfigurationException("Band " + band.getLabel() + " of " + code + " starts outside [0, 100]");
            }
            if (!bounds.add(lb)) {
                throw new InvalidGradingConfigurationException("Two bands of " + code + " start at " + lb);
            }
        }
        List<GradeBand> sorted = new ArrayList<>(bands);
        sorted.sort(Comparator.comparingDouble(GradeBand::getLowerBound).reversed());
        if (sorted.get(sorted.size() - 1).getLowerBound() != 0.0) {
            throw new InvalidGradingConfigurationException("Bands of " + code + " do not reach 0");
        }
        this.code = code;
        this.name = name == null ? code : name;
        this.passMark = passMark;
        this.bands = List.copyOf(sorted);
    }
}
