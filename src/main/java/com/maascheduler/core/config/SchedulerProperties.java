package com.maascheduler.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "maa")
public class SchedulerProperties {

    private Scheduler scheduler = new Scheduler();
    private Device device = new Device();
    private Logs logs = new Logs();
    private Webhook webhook = new Webhook();

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Device getDevice() { return device; }
    public void setDevice(Device device) { this.device = device; }
    public Logs getLogs() { return logs; }
    public void setLogs(Logs logs) { this.logs = logs; }
    public Webhook getWebhook() { return webhook; }
    public void setWebhook(Webhook webhook) { this.webhook = webhook; }

    public static class Scheduler {
        /** Task catalog (YAML). */
        private String configFile = "config/tasks.yaml";
        /** Persisted mode and device state (JSON). */
        private String stateFile = "config/state.json";
        private boolean autoStart = true;
        private Duration workerPollInterval = Duration.ofSeconds(1);
        private Duration admissionBackoff = Duration.ofSeconds(5);
        private Duration cancelGracePeriod = Duration.ofSeconds(5);
        private int liveLogLines = 500;
        private int historyLimit = 200;

        public String getConfigFile() { return configFile; }
        public void setConfigFile(String configFile) { this.configFile = configFile; }
        public String getStateFile() { return stateFile; }
        public void setStateFile(String stateFile) { this.stateFile = stateFile; }
        public boolean isAutoStart() { return autoStart; }
        public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }
        public Duration getWorkerPollInterval() { return workerPollInterval; }
        public void setWorkerPollInterval(Duration workerPollInterval) { this.workerPollInterval = workerPollInterval; }
        public Duration getAdmissionBackoff() { return admissionBackoff; }
        public void setAdmissionBackoff(Duration admissionBackoff) { this.admissionBackoff = admissionBackoff; }
        public Duration getCancelGracePeriod() { return cancelGracePeriod; }
        public void setCancelGracePeriod(Duration cancelGracePeriod) { this.cancelGracePeriod = cancelGracePeriod; }
        public int getLiveLogLines() { return liveLogLines; }
        public void setLiveLogLines(int liveLogLines) { this.liveLogLines = liveLogLines; }
        public int getHistoryLimit() { return historyLimit; }
        public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
    }

    public static class Device {
        private String adbPath = "adb";
        private Duration wakeSettleDelay = Duration.ofMillis(500);

        public String getAdbPath() { return adbPath; }
        public void setAdbPath(String adbPath) { this.adbPath = adbPath; }
        public Duration getWakeSettleDelay() { return wakeSettleDelay; }
        public void setWakeSettleDelay(Duration wakeSettleDelay) { this.wakeSettleDelay = wakeSettleDelay; }
    }

    public static class Logs {
        private String directory = "logs";
        /** Run logs kept per task. */
        private int retentionCount = 20;
        /** Run logs older than this are deleted; 0 keeps them regardless of age. */
        private int retentionDays = 7;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public int getRetentionCount() { return retentionCount; }
        public void setRetentionCount(int retentionCount) { this.retentionCount = retentionCount; }
        public int getRetentionDays() { return retentionDays; }
        public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }
    }

    public static class Webhook {
        private String baseUrl = "";
        private String token = "";
        private String uid = "";
        private Duration timeout = Duration.ofSeconds(10);

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank() && token != null && !token.isBlank();
        }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getUid() { return uid; }
        public void setUid(String uid) { this.uid = uid; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
