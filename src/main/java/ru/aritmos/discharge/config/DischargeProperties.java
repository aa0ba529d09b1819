package ru.aritmos.discharge.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.util.Locale;

/**
 * Typed-конфигурация ядра Discharge Assist.
 * <p>
 * Единая точка чтения настроек из application.yml/ENV: подключение к генеративной модели,
 * пороги проверок безопасности, ограничения Q&A, ожидание коалесцера и контакты care team.
 */
@ConfigurationProperties("discharge")
public class DischargeProperties {

    private Model model = new Model();
    private Safety safety = new Safety();
    private Qa qa = new Qa();
    private Cache cache = new Cache();
    private CareTeam careTeam = new CareTeam();

    public Model getModel() {
        return model;
    }

    public void setModel(Model model) {
        this.model = model == null ? new Model() : model;
    }

    public Safety getSafety() {
        return safety;
    }

    public void setSafety(Safety safety) {
        this.safety = safety == null ? new Safety() : safety;
    }

    public Qa getQa() {
        return qa;
    }

    public void setQa(Qa qa) {
        this.qa = qa == null ? new Qa() : qa;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache == null ? new Cache() : cache;
    }

    public CareTeam getCareTeam() {
        return careTeam;
    }

    public void setCareTeam(CareTeam careTeam) {
        this.careTeam = careTeam == null ? new CareTeam() : careTeam;
    }

    /**
     * Подключение к OpenAI-совместимому chat-completions endpoint (по умолчанию OpenRouter).
     */
    @ConfigurationProperties("model")
    public static class Model {
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKey;
        private String name = "meta-llama/llama-3.2-3b-instruct:free";
        private long connectTimeoutMs = 3000;
        private long requestTimeoutMs = 30000;
        private double instructionsTemperature = 0.3;
        private double qaTemperature = 0.2;
        private int instructionsMaxTokens = 2000;
        private int qaMaxTokens = 1000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? "https://openrouter.ai/api/v1" : baseUrl.trim();
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = (apiKey == null || apiKey.isBlank()) ? null : apiKey.trim();
        }

        /**
         * @return true, если ключ доступа к модели задан
         */
        public boolean isConfigured() {
            return apiKey != null;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = (name == null || name.isBlank()) ? "meta-llama/llama-3.2-3b-instruct:free" : name.trim();
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = Math.max(100, connectTimeoutMs);
        }

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = Math.max(100, requestTimeoutMs);
        }

        public double getInstructionsTemperature() {
            return instructionsTemperature;
        }

        public void setInstructionsTemperature(double instructionsTemperature) {
            this.instructionsTemperature = clampTemperature(instructionsTemperature);
        }

        public double getQaTemperature() {
            return qaTemperature;
        }

        public void setQaTemperature(double qaTemperature) {
            this.qaTemperature = clampTemperature(qaTemperature);
        }

        public int getInstructionsMaxTokens() {
            return instructionsMaxTokens;
        }

        public void setInstructionsMaxTokens(int instructionsMaxTokens) {
            this.instructionsMaxTokens = Math.max(256, instructionsMaxTokens);
        }

        public int getQaMaxTokens() {
            return qaMaxTokens;
        }

        public void setQaMaxTokens(int qaMaxTokens) {
            this.qaMaxTokens = Math.max(128, qaMaxTokens);
        }

        private static double clampTemperature(double value) {
            return Math.max(0.0, Math.min(2.0, value));
        }
    }

    @ConfigurationProperties("safety")
    public static class Safety {
        private String warningSignsSeverityThreshold = "high";

        public String getWarningSignsSeverityThreshold() {
            return warningSignsSeverityThreshold;
        }

        public void setWarningSignsSeverityThreshold(String warningSignsSeverityThreshold) {
            this.warningSignsSeverityThreshold = (warningSignsSeverityThreshold == null || warningSignsSeverityThreshold.isBlank())
                    ? "high"
                    : warningSignsSeverityThreshold.trim().toLowerCase(Locale.ROOT);
        }
    }

    @ConfigurationProperties("qa")
    public static class Qa {
        private int maxQuestionLength = 2000;
        private double lowConfidenceThreshold = 0.5;

        public int getMaxQuestionLength() {
            return maxQuestionLength;
        }

        public void setMaxQuestionLength(int maxQuestionLength) {
            this.maxQuestionLength = Math.max(1, maxQuestionLength);
        }

        public double getLowConfidenceThreshold() {
            return lowConfidenceThreshold;
        }

        public void setLowConfidenceThreshold(double lowConfidenceThreshold) {
            this.lowConfidenceThreshold = Math.max(0.0, Math.min(1.0, lowConfidenceThreshold));
        }
    }

    @ConfigurationProperties("cache")
    public static class Cache {
        private long waitTimeoutMs = 120000;

        public long getWaitTimeoutMs() {
            return waitTimeoutMs;
        }

        public void setWaitTimeoutMs(long waitTimeoutMs) {
            this.waitTimeoutMs = Math.max(100, waitTimeoutMs);
        }
    }

    /**
     * Контакты учреждения, которые всегда попадают в раздел экстренных контактов.
     */
    @ConfigurationProperties("care-team")
    public static class CareTeam {
        private String emergencyServicesName = "Emergency Services";
        private String emergencyServicesPhone = "911";
        private String facilityName;
        private String facilityPhone;

        public String getEmergencyServicesName() {
            return emergencyServicesName;
        }

        public void setEmergencyServicesName(String emergencyServicesName) {
            this.emergencyServicesName = normalize(emergencyServicesName, "Emergency Services");
        }

        public String getEmergencyServicesPhone() {
            return emergencyServicesPhone;
        }

        public void setEmergencyServicesPhone(String emergencyServicesPhone) {
            this.emergencyServicesPhone = normalize(emergencyServicesPhone, "911");
        }

        public String getFacilityName() {
            return facilityName;
        }

        public void setFacilityName(String facilityName) {
            this.facilityName = normalize(facilityName, null);
        }

        public String getFacilityPhone() {
            return facilityPhone;
        }

        public void setFacilityPhone(String facilityPhone) {
            this.facilityPhone = normalize(facilityPhone, null);
        }

        private static String normalize(String value, String fallback) {
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return value.trim();
        }
    }
}
