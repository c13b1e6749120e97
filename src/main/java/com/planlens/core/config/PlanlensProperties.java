package com.planlens.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "planlens")
public class PlanlensProperties {

    private Risk risk = new Risk();
    private Report report = new Report();

    // -- Risk accessors (delegate to nested) --
    public String getRiskIdPrefix() { return risk.idPrefix; }

    // -- Report accessors (delegate to nested) --
    public String getDefaultFormat() { return report.defaultFormat; }
    public boolean isPrettyJson() { return report.prettyJson; }

    public Risk getRisk() { return risk; }
    public void setRisk(Risk risk) { this.risk = risk; }
    public Report getReport() { return report; }
    public void setReport(Report report) { this.report = report; }

    public static class Risk {
        /** Prefix of risk-factor ids, e.g. "risk" gives "risk-1", "risk-2". */
        private String idPrefix = "risk";

        public String getIdPrefix() { return idPrefix; }
        public void setIdPrefix(String idPrefix) { this.idPrefix = idPrefix; }
    }

    public static class Report {
        /** CLI output format when --format is not given: "text" or "json". */
        private String defaultFormat = "text";
        private boolean prettyJson = true;

        public String getDefaultFormat() { return defaultFormat; }
        public void setDefaultFormat(String defaultFormat) { this.defaultFormat = defaultFormat; }
        public boolean isPrettyJson() { return prettyJson; }
        public void setPrettyJson(boolean prettyJson) { this.prettyJson = prettyJson; }
    }
}
