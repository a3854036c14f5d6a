package com.example.equationreader.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "equation-reader")
public class EquationReaderProperties {

    private final Ocr ocr = new Ocr();
    private final Standardizer standardizer = new Standardizer();

    public Ocr getOcr() {
        return ocr;
    }

    public Standardizer getStandardizer() {
        return standardizer;
    }

    public static class Ocr {

        /** Recognizer implementation: {@code remote} (LaTeX-OCR server) or {@code tesseract}. */
        private String engine = "remote";
        /** Hard cutoff for a single recognition. */
        private Duration timeout = Duration.ofSeconds(30);
        private int maxConcurrency = 1;
        private final Remote remote = new Remote();
        private final Tesseract tesseract = new Tesseract();

        public String getEngine() {
            return engine;
        }

        public void setEngine(String engine) {
            this.engine = engine;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public Remote getRemote() {
            return remote;
        }

        public Tesseract getTesseract() {
            return tesseract;
        }
    }

    public static class Remote {

        private String baseUrl = "http://127.0.0.1:8502";
        private Duration connectTimeout = Duration.ofSeconds(5);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }
    }

    public static class Tesseract {

        private String datapath = "";
        private String language = "eng";
        private String whitelist = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ+-*/=^()[]{}.,|!<>";

        public String getDatapath() {
            return datapath;
        }

        public void setDatapath(String datapath) {
            this.datapath = datapath;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getWhitelist() {
            return whitelist;
        }

        public void setWhitelist(String whitelist) {
            this.whitelist = whitelist;
        }
    }

    public static class Standardizer {

        private boolean enabled = false;
        private String baseUrl = "http://127.0.0.1:11434";
        private String model = "llama3.2";
        private Duration timeout = Duration.ofSeconds(3);
        /** Confidence base used instead of the heuristic score when the standardizer answered. */
        private double trustScore = 0.95;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public double getTrustScore() {
            return trustScore;
        }

        public void setTrustScore(double trustScore) {
            this.trustScore = trustScore;
        }
    }
}
