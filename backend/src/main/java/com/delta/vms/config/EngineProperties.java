package com.delta.vms.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "engine")
public class EngineProperties {
    private static final String DEFAULT_USER_AGENT = "vendor-engine/0.1";

    private Ownership ownership = new Ownership();
    private Matching matching = new Matching();
    private Distribution distribution = new Distribution();
    private Fees fees = new Fees();
    private Budget budget = new Budget();
    private Forecast forecast = new Forecast();
    private Sla sla = new Sla();
    private Alerts alerts = new Alerts();
    private Daemon daemon = new Daemon();
    private RateImport rateImport = new RateImport();

    public Ownership getOwnership() {
        return ownership;
    }

    public void setOwnership(Ownership ownership) {
        this.ownership = ownership;
    }

    public Matching getMatching() {
        return matching;
    }

    public void setMatching(Matching matching) {
        this.matching = matching;
    }

    public Distribution getDistribution() {
        return distribution;
    }

    public void setDistribution(Distribution distribution) {
        this.distribution = distribution;
    }

    public Fees getFees() {
        return fees;
    }

    public void setFees(Fees fees) {
        this.fees = fees;
    }

    public Budget getBudget() {
        return budget;
    }

    public void setBudget(Budget budget) {
        this.budget = budget;
    }

    public Forecast getForecast() {
        return forecast;
    }

    public void setForecast(Forecast forecast) {
        this.forecast = forecast;
    }

    public Sla getSla() {
        return sla;
    }

    public void setSla(Sla sla) {
        this.sla = sla;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public void setAlerts(Alerts alerts) {
        this.alerts = alerts;
    }

    public Daemon getDaemon() {
        return daemon;
    }

    public void setDaemon(Daemon daemon) {
        this.daemon = daemon;
    }

    public RateImport getRateImport() {
        return rateImport;
    }

    public void setRateImport(RateImport rateImport) {
        this.rateImport = rateImport;
    }

    public static class Ownership {
        private int protectionPeriodDays = 365;
        private String defaultCountryCallingCode = "31";

        public int getProtectionPeriodDays() {
            return Math.max(1, protectionPeriodDays);
        }

        public void setProtectionPeriodDays(int protectionPeriodDays) {
            this.protectionPeriodDays = Math.max(1, protectionPeriodDays);
        }

        public String getDefaultCountryCallingCode() {
            return defaultCountryCallingCode;
        }

        public void setDefaultCountryCallingCode(String defaultCountryCallingCode) {
            if (defaultCountryCallingCode == null || defaultCountryCallingCode.isBlank()) {
                this.defaultCountryCallingCode = "31";
                return;
            }
            this.defaultCountryCallingCode = defaultCountryCallingCode.replaceAll("[^0-9]", "");
        }
    }

    public static class Matching {
        private double specializationWeight = 0.5;
        private double geographicWeight = 0.2;
        private double performanceWeight = 0.3;
        private int experienceCapYears = 10;
        private int defaultLimit = 10;
        private int maxLimit = 100;
        private double exclusiveMinScore = 80.0;
        private double preferredMinScore = 65.0;
        private double standardMinScore = 40.0;
        private double exclusiveTopFraction = 0.10;

        public double getSpecializationWeight() {
            return Math.max(0.0, specializationWeight);
        }

        public void setSpecializationWeight(double specializationWeight) {
            this.specializationWeight = Math.max(0.0, specializationWeight);
        }

        public double getGeographicWeight() {
            return Math.max(0.0, geographicWeight);
        }

        public void setGeographicWeight(double geographicWeight) {
            this.geographicWeight = Math.max(0.0, geographicWeight);
        }

        public double getPerformanceWeight() {
            return Math.max(0.0, performanceWeight);
        }

        public void setPerformanceWeight(double performanceWeight) {
            this.performanceWeight = Math.max(0.0, performanceWeight);
        }

        public int getExperienceCapYears() {
            return Math.max(1, experienceCapYears);
        }

        public void setExperienceCapYears(int experienceCapYears) {
            this.experienceCapYears = Math.max(1, experienceCapYears);
        }

        public int getDefaultLimit() {
            return Math.max(1, defaultLimit);
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }

        public int getMaxLimit() {
            return Math.max(getDefaultLimit(), maxLimit);
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }

        public double getExclusiveMinScore() {
            return exclusiveMinScore;
        }

        public void setExclusiveMinScore(double exclusiveMinScore) {
            this.exclusiveMinScore = exclusiveMinScore;
        }

        public double getPreferredMinScore() {
            return preferredMinScore;
        }

        public void setPreferredMinScore(double preferredMinScore) {
            this.preferredMinScore = preferredMinScore;
        }

        public double getStandardMinScore() {
            return standardMinScore;
        }

        public void setStandardMinScore(double standardMinScore) {
            this.standardMinScore = standardMinScore;
        }

        public double getExclusiveTopFraction() {
            return Math.min(1.0, Math.max(0.0, exclusiveTopFraction));
        }

        public void setExclusiveTopFraction(double exclusiveTopFraction) {
            this.exclusiveTopFraction = Math.min(1.0, Math.max(0.0, exclusiveTopFraction));
        }
    }

    public static class Distribution {
        private int defaultExclusiveDays = 14;
        private int autoDistributeLimit = 5;

        public int getDefaultExclusiveDays() {
            return Math.max(1, defaultExclusiveDays);
        }

        public void setDefaultExclusiveDays(int defaultExclusiveDays) {
            this.defaultExclusiveDays = Math.max(1, defaultExclusiveDays);
        }

        public int getAutoDistributeLimit() {
            return Math.max(1, autoDistributeLimit);
        }

        public void setAutoDistributeLimit(int autoDistributeLimit) {
            this.autoDistributeLimit = Math.max(1, autoDistributeLimit);
        }
    }

    public static class Fees {
        private int defaultHoursPerWeek = 40;
        // Placements counted towards a volume discount, trailing window.
        private int volumeDiscountWindowDays = 365;

        public int getDefaultHoursPerWeek() {
            return Math.max(1, defaultHoursPerWeek);
        }

        public void setDefaultHoursPerWeek(int defaultHoursPerWeek) {
            this.defaultHoursPerWeek = Math.max(1, defaultHoursPerWeek);
        }

        public int getVolumeDiscountWindowDays() {
            return Math.max(1, volumeDiscountWindowDays);
        }

        public void setVolumeDiscountWindowDays(int volumeDiscountWindowDays) {
            this.volumeDiscountWindowDays = Math.max(1, volumeDiscountWindowDays);
        }
    }

    public static class Budget {
        private int recentTransactionLimit = 20;

        public int getRecentTransactionLimit() {
            return Math.max(1, recentTransactionLimit);
        }

        public void setRecentTransactionLimit(int recentTransactionLimit) {
            this.recentTransactionLimit = Math.max(1, recentTransactionLimit);
        }
    }

    public static class Forecast {
        private int windowDays = 60;
        private int defaultHorizonDays = 30;
        private int maxHorizonDays = 365;
        private double confidenceZ = 1.96;

        public int getWindowDays() {
            return Math.max(1, windowDays);
        }

        public void setWindowDays(int windowDays) {
            this.windowDays = Math.max(1, windowDays);
        }

        public int getDefaultHorizonDays() {
            return Math.max(1, Math.min(defaultHorizonDays, getMaxHorizonDays()));
        }

        public void setDefaultHorizonDays(int defaultHorizonDays) {
            this.defaultHorizonDays = Math.max(1, defaultHorizonDays);
        }

        public int getMaxHorizonDays() {
            return Math.max(1, maxHorizonDays);
        }

        public void setMaxHorizonDays(int maxHorizonDays) {
            this.maxHorizonDays = Math.max(1, maxHorizonDays);
        }

        public double getConfidenceZ() {
            return Math.max(0.0, confidenceZ);
        }

        public void setConfidenceZ(double confidenceZ) {
            this.confidenceZ = Math.max(0.0, confidenceZ);
        }
    }

    public static class Sla {
        private String defaultAlertRecipient;
        private int alertDispatchBatchSize = 50;
        private boolean dispatchOnBreach = true;

        public String getDefaultAlertRecipient() {
            return defaultAlertRecipient;
        }

        public void setDefaultAlertRecipient(String defaultAlertRecipient) {
            this.defaultAlertRecipient = defaultAlertRecipient;
        }

        public int getAlertDispatchBatchSize() {
            return Math.max(1, alertDispatchBatchSize);
        }

        public void setAlertDispatchBatchSize(int alertDispatchBatchSize) {
            this.alertDispatchBatchSize = Math.max(1, alertDispatchBatchSize);
        }

        public boolean isDispatchOnBreach() {
            return dispatchOnBreach;
        }

        public void setDispatchOnBreach(boolean dispatchOnBreach) {
            this.dispatchOnBreach = dispatchOnBreach;
        }
    }

    public static class Alerts {
        private String userAgent;
        private int webhookTimeoutSeconds = 10;

        public String getUserAgent() {
            if (userAgent == null || userAgent.isBlank()) {
                return DEFAULT_USER_AGENT;
            }
            return userAgent.trim();
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public int getWebhookTimeoutSeconds() {
            return Math.max(1, webhookTimeoutSeconds);
        }

        public void setWebhookTimeoutSeconds(int webhookTimeoutSeconds) {
            this.webhookTimeoutSeconds = Math.max(1, webhookTimeoutSeconds);
        }
    }

    public static class Daemon {
        private boolean enabled = false;
        private int intervalSeconds = 300;
        private int forecastHorizonDays = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalSeconds() {
            return Math.max(1, intervalSeconds);
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = Math.max(1, intervalSeconds);
        }

        public int getForecastHorizonDays() {
            return Math.max(1, forecastHorizonDays);
        }

        public void setForecastHorizonDays(int forecastHorizonDays) {
            this.forecastHorizonDays = Math.max(1, forecastHorizonDays);
        }
    }

    public static class RateImport {
        private boolean run = false;
        private String path;
        private String tenantId;
        private Long rateCardId;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getTenantId() {
            return tenantId;
        }

        public void setTenantId(String tenantId) {
            this.tenantId = tenantId;
        }

        public Long getRateCardId() {
            return rateCardId;
        }

        public void setRateCardId(Long rateCardId) {
            this.rateCardId = rateCardId;
        }
    }
}
