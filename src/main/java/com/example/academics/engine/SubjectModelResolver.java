package com.example.academics.engine;

import com.example.academics.engine.exception.InvalidCompositeDefinitionException;
import com.example.academics.engine.model.Subject;
import com.example.academics.engine.model.SubjectComponent;
import com.example.academics.engine.model.SubjectStructure;
import com.example.academics.engine.model.WeightedComponent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies a subject as atomic or composite and checks composite definitions before any
 * mark is weighted with them.
 */
public class SubjectModelResolver {

    public static final double WEIGHT_EPSILON = 1e-6;

    public SubjectStructure resolve(Subject subject) {
        if (subject == null) {
            throw new IllegalArgumentException("subject required");
        }
        List<SubjectComponent> components = subject.getComponents() == null ? List.of() : subject.getComponents();

        if (!subject.isComposite()) {
            if (!components.isEmpty()) {
                throw new InvalidCompositeDefinitionException(
                        "Subject " + describe(subject) + " is not composite but declares " + components.size() + " components");
            }
            return SubjectStructure.atomic();
        }

        if (components.isEmpty()) {
            throw new InvalidCompositeDefinitionException("Composite subject " + describe(subject) + " has no components");
        }

        List<WeightedComponent> weighted = new ArrayList<>(components.size());
        Set<Long> ids = new HashSet<>();
        double sum = 0;
        for (SubjectComponent c : components) {
            if (c.getId() == null || !ids.add(c.getId())) {
                throw new InvalidCompositeDefinitionException(
                        "Composite subject " + describe(subject) + " has a missing or repeated component id: " + c.getId());
            }
            if (!(c.getWeight() > 0)) {
                throw new InvalidCompositeDefinitionException(
                        "Component " + c.getName() + " of " + describe(subject) + " has non-positive weight " + c.getWeight());
            }
            sum += c.getWeight();
            weighted.add(new WeightedComponent(c, c.getWeight()));
        }
        if (Math.abs(sum - 1.0) > WEIGHT_EPSILON) {
            throw new InvalidCompositeDefinitionException(
                    "Component weights of " + describe(subject) + " sum to " + sum + ", expected 1.0");
        }
        return SubjectStructure.composite(weighted);
    }

    private static String describe(Subject subject) {
        return subject.getName() + " (id=" + subject.getId() + ")";
    }
}
