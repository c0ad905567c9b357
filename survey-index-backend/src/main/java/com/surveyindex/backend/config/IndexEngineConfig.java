package com.surveyindex.backend.config;

import com.surveyindex.backend.dto.TelemetryRecordParser;
import com.surveyindex.backend.evaluation.ConflictScorer;
import com.surveyindex.backend.evaluation.EngagementScorer;
import com.surveyindex.backend.evaluation.GeometryAnalyzer;
import com.surveyindex.backend.evaluation.SessionQualityScorer;
import com.surveyindex.backend.report.SessionReportPdfGenerator;
import com.surveyindex.backend.service.HistoryStore;
import com.surveyindex.backend.service.IndexEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class IndexEngineConfig implements WebMvcConfigurer {

    private final SurveyIndexProperties properties;

    public IndexEngineConfig(SurveyIndexProperties properties) {
        this.properties = properties;
    }

    @Bean
    public GeometryAnalyzer geometryAnalyzer() {
        return new GeometryAnalyzer();
    }

    @Bean
    public ConflictScorer conflictScorer(GeometryAnalyzer geometryAnalyzer) {
        return new ConflictScorer(geometryAnalyzer);
    }

    @Bean
    public EngagementScorer engagementScorer(GeometryAnalyzer geometryAnalyzer) {
        return new EngagementScorer(geometryAnalyzer);
    }

    @Bean
    public SessionQualityScorer sessionQualityScorer() {
        return new SessionQualityScorer();
    }

    // one history per running service; /reset starts a new session
    @Bean
    public HistoryStore historyStore() {
        return new HistoryStore();
    }

    @Bean
    public IndexEngine indexEngine(GeometryAnalyzer geometryAnalyzer,
                                   ConflictScorer conflictScorer,
                                   EngagementScorer engagementScorer,
                                   SessionQualityScorer sessionQualityScorer,
                                   HistoryStore historyStore) {
        return new IndexEngine(
                new TelemetryRecordParser(),
                geometryAnalyzer,
                conflictScorer,
                engagementScorer,
                sessionQualityScorer,
                historyStore
        );
    }

    @Bean
    public SessionReportPdfGenerator sessionReportPdfGenerator() {
        return new SessionReportPdfGenerator(properties.getReport().getTitle());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(properties.getCors().getAllowedOrigins().toArray(new String[0]))
                .allowedMethods("GET", "POST");
    }
}
