package com.example.academics.engine.port;

import com.example.academics.engine.model.GradingSystem;

import java.util.List;

public interface GradingConfigurationSource {

    List<GradingSystem> gradingSystems();

    /** Code of the system overall and subject grades are reported in. */
    String activeSystemCode();
}
