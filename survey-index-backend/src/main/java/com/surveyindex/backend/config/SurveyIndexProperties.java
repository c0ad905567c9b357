package com.surveyindex.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "survey-index")
public class SurveyIndexProperties {

    private final Cors cors = new Cors();
    private final Websocket websocket = new Websocket();
    private final Report report = new Report();

    public Cors getCors() {
        return cors;
    }

    public Websocket getWebsocket() {
        return websocket;
    }

    public Report getReport() {
        return report;
    }

    public static class Cors {

        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }

    public static class Websocket {

        /** Path of the streaming telemetry endpoint. */
        private String path = "/ws/telemetry";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Report {

        private String title = "SURVEY SESSION REPORT";

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }
    }
}
