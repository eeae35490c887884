package com.example.academics.config;

import com.example.academics.engine.AggregationSettings;
import com.example.academics.engine.ClassRanker;
import com.example.academics.engine.CohortSummarizer;
import com.example.academics.engine.GradingVocabulary;
import com.example.academics.engine.MarkNormalizer;
import com.example.academics.engine.StudentAggregator;
import com.example.academics.engine.SubjectModelResolver;
import com.example.academics.engine.port.GradingConfigurationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the aggregation engine. Engine classes are plain Java; every setting they need is passed in here.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public GradingVocabulary gradingVocabulary(GradingConfigurationSource gradingConfiguration) {
        GradingVocabulary vocabulary = new GradingVocabulary(gradingConfiguration.gradingSystems());
        // fail at startup rather than on the first report
        vocabulary.system(gradingConfiguration.activeSystemCode());
        log.info("Grading systems registered: {} (active: {})", vocabulary.systemCodes(), gradingConfiguration.activeSystemCode());
        return vocabulary;
    }

    @Bean
    public AggregationSettings aggregationSettings(GradingConfigurationSource gradingConfiguration, AcademicsProperties properties) {
        return AggregationSettings.builder()
                .gradingSystem(gradingConfiguration.activeSystemCode())
                .defaultSubjectMaxScale(properties.getScale().getDefaultSubjectMax())
                .assessmentScales(properties.getScale().getAssessments())
                .build();
    }

    @Bean
    public SubjectModelResolver subjectModelResolver() {
        return new SubjectModelResolver();
    }

    @Bean
    public MarkNormalizer markNormalizer(SubjectModelResolver resolver) {
        return new MarkNormalizer(resolver);
    }

    @Bean
    public StudentAggregator studentAggregator(MarkNormalizer normalizer, GradingVocabulary vocabulary, AggregationSettings settings) {
        return new StudentAggregator(normalizer, vocabulary, settings);
    }

    @Bean
    public ClassRanker classRanker() {
        return new ClassRanker();
    }

    @Bean
    public CohortSummarizer cohortSummarizer(GradingVocabulary vocabulary, AggregationSettings settings) {
        return new CohortSummarizer(vocabulary, settings);
    }
}
