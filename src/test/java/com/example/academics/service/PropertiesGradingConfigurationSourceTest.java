package com.example.academics.service;

import com.example.academics.config.AcademicsProperties;
import com.example.academics.engine.GradingVocabulary;
import com.example.academics.engine.exception.InvalidGradingConfigurationException;
import com.example.academics.engine.model.GradingSystem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertiesGradingConfigurationSourceTest {

    private static AcademicsProperties.BandConfig band(double min, String label, double points) {
        AcademicsProperties.BandConfig b = new AcademicsProperties.BandConfig();
        b.setMin(min);
        b.setLabel(label);
        b.setDescription(label);
        b.setPoints(points);
        return b;
    }

    private static AcademicsProperties.SystemConfig system(String code, AcademicsProperties.BandConfig... bands) {
        AcademicsProperties.SystemConfig cfg = new AcademicsProperties.SystemConfig();
        cfg.setCode(code);
        cfg.setName(code + " rubric");
        cfg.setBands(List.of(bands));
        return cfg;
    }

    @Test
    void builtInSystemsByDefault() {
        PropertiesGradingConfigurationSource source = new PropertiesGradingConfigurationSource(new AcademicsProperties());

        assertThat(source.gradingSystems()).extracting(GradingSystem::getCode)
                .containsExactly("CBC", "CBC_DETAILED", "PERCENTAGE", "LETTER");
        assertThat(source.activeSystemCode()).isEqualTo("CBC");
    }

    @Test
    void configuredSystemAddsOrReplaces() {
        AcademicsProperties properties = new AcademicsProperties();
        properties.getGrading().setSystems(List.of(
                system("CBC", band(60, "E.E", 4), band(0, "B.E", 1)),
                system("SCHOOL", band(80, "A", 4), band(0, "B", 1))));
        properties.getGrading().setActiveSystem("SCHOOL");

        PropertiesGradingConfigurationSource source = new PropertiesGradingConfigurationSource(properties);
        GradingVocabulary vocabulary = new GradingVocabulary(source.gradingSystems());

        assertThat(vocabulary.systemCodes()).contains("CBC", "SCHOOL");
        assertThat(vocabulary.gradeFor(65.0, "CBC").getLabel()).isEqualTo("E.E");
        assertThat(vocabulary.gradeFor(79.9, "SCHOOL").getLabel()).isEqualTo("B");
        assertThat(source.activeSystemCode()).isEqualTo("SCHOOL");
    }

    @Test
    void invalidConfiguredBandsRejected() {
        AcademicsProperties properties = new AcademicsProperties();
        properties.getGrading().setSystems(List.of(system("GAP", band(50, "P", 1))));

        assertThatThrownBy(() -> new PropertiesGradingConfigurationSource(properties).gradingSystems())
                .isInstanceOf(InvalidGradingConfigurationException.class);
    }
}
