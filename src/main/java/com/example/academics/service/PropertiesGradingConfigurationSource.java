package com.example.academics.service;

import com.example.academics.config.AcademicsProperties;
import com.example.academics.engine.DefaultGradingSystems;
import com.example.academics.engine.model.GradeBand;
import com.example.academics.engine.model.GradingSystem;
import com.example.academics.engine.port.GradingConfigurationSource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in grading systems overlaid with the systems declared under {@code academics.grading.systems}.
 * A configured system replaces the built-in one with the same code.
 */
@Component
@RequiredArgsConstructor
public class PropertiesGradingConfigurationSource implements GradingConfigurationSource {

    private final Logger log = LoggerFactory.getLogger(PropertiesGradingConfigurationSource.class);

    private final AcademicsProperties properties;

    @Override
    public List<GradingSystem> gradingSystems() {
        Map<String, GradingSystem> byCode = new LinkedHashMap<>();
        for (GradingSystem system : DefaultGradingSystems.all()) {
            byCode.put(system.getCode(), system);
        }
        for (AcademicsProperties.SystemConfig cfg : properties.getGrading().getSystems()) {
            GradingSystem system = toSystem(cfg);
            if (byCode.put(system.getCode(), system) != null) {
                log.info("Grading system {} overridden by configuration", system.getCode());
            }
        }
        return new ArrayList<>(byCode.values());
    }

    @Override
    public String activeSystemCode() {
        return properties.getGrading().getActiveSystem();
    }

    private static GradingSystem toSystem(AcademicsProperties.SystemConfig cfg) {
        List<GradeBand> bands = new ArrayList<>();
        for (AcademicsProperties.BandConfig b : cfg.getBands()) {
            bands.add(new GradeBand(b.getMin(), b.getLabel(), b.getDescription(), b.getPoints()));
        }
        return new GradingSystem(cfg.getCode(), cfg.getName(), cfg.getPassMark(), bands);
    }
}
