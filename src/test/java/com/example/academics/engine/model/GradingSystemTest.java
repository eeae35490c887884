package com.example.academics.engine.model;

import com.example.academics.engine.exception.InvalidGradingConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GradingSystemTest {

    @Test
    void bandsAreSortedHighToLow() {
        GradingSystem system = new GradingSystem("PF", "Pass/Fail", 50, List.of(
                new GradeBand(0, "F", "Fail", 0),
                new GradeBand(50, "P", "Pass", 1)));

        assertThat(system.getBands()).extracting(GradeBand::getLabel).containsExactly("P", "F");
        assertThat(system.getName()).isEqualTo("Pass/Fail");
    }

    @Test
    void bandsMustReachZero() {
        assertThatThrownBy(() -> new GradingSystem("X", "X", 50, List.of(
                new GradeBand(50, "P", "Pass", 1),
                new GradeBand(10, "F", "Fail", 0))))
                .isInstanceOf(InvalidGradingConfigurationException.class)
                .hasMessageContaining("do not reach 0");
    }

    @Test
    void rejectsDuplicateLabelsAndBounds() {
        assertThatThrownBy(() -> new GradingSystem("X", "X", 50, List.of(
                new GradeBand(50, "A", "a", 1),
                new GradeBand(0, "A", "b", 0))))
                .isInstanceOf(InvalidGradingConfigurationException.class);
        assertThatThrownBy(() -> new GradingSystem("X", "X", 50, List.of(
                new GradeBand(0, "A", "a", 1),
                new GradeBand(0, "B", "b", 0))))
                .isInstanceOf(InvalidGradingConfigurationException.class);
    }

    @Test
    void rejectsBadTables() {
        assertThatThrownBy(() -> new GradingSystem("X", "X", 50, List.of()))
                .isInstanceOf(InvalidGradingConfigurationException.class);
        assertThatThrownBy(() -> new GradingSystem(" ", "X", 50, List.of(new GradeBand(0, "A", "a", 1))))
                .isInstanceOf(InvalidGradingConfigurationException.class);
        assertThatThrownBy(() -> new GradingSystem("X", "X", 120, List.of(new GradeBand(0, "A", "a", 1))))
                .isInstanceOf(InvalidGradingConfigurationException.class);
        assertThatThrownBy(() -> new GradingSystem("X", "X", 50, List.of(
                new GradeBand(101, "A", "a", 1),
                new GradeBand(0, "B", "b", 0))))
                .isInstanceOf(InvalidGradingConfigurationException.class);
    }
}
