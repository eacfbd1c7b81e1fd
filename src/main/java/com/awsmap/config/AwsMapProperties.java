package com.awsmap.config;

import com.awsmap.inventory.execution.ScanScheduler;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "awsmap")
public class AwsMapProperties {

    // Used when the account's enabled regions cannot be listed.
    public static final List<String> DEFAULT_FALLBACK_REGIONS = List.of(
            "us-east-1", "us-east-2", "us-west-1", "us-west-2",
            "eu-west-1", "eu-west-2", "eu-west-3", "eu-central-1", "eu-north-1",
            "ap-northeast-1", "ap-northeast-2", "ap-northeast-3",
            "ap-southeast-1", "ap-southeast-2", "ap-south-1",
            "sa-east-1", "ca-central-1");

    private int workers = ScanScheduler.DEFAULT_CONCURRENCY;
    private String profile;
    private boolean includeGlobal;
    private boolean timings;
    private List<String> fallbackRegions = new ArrayList<>(DEFAULT_FALLBACK_REGIONS);
    private ScanSettings scan = new ScanSettings();
    private CliSettings cli = new CliSettings();

    public static class ScanSettings {
        private List<String> regions = new ArrayList<>();
        private List<String> services = new ArrayList<>();
        private List<String> tags = new ArrayList<>();

        public List<String> getRegions() { return regions; }
        public void setRegions(List<String> regions) { this.regions = regions != null ? new ArrayList<>(regions) : new ArrayList<>(); }
        public List<String> getServices() { return services; }
        public void setServices(List<String> services) { this.services = services != null ? new ArrayList<>(services) : new ArrayList<>(); }
        public List<String> getTags() { return tags; }
        public void setTags(List<String> tags) { this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>(); }
    }

    public static class CliSettings {
        private boolean enabled;
        private String format = "json";
        private String output;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getFormat() { return format; }
        public void setFormat(String format) { this.format = format; }
        public String getOutput() { return output; }
        public void setOutput(String output) { this.output = output; }
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public String getProfile() {
        return profile;
    }

    public void setProfile(String profile) {
        this.profile = profile;
    }

    public boolean isIncludeGlobal() {
        return includeGlobal;
    }

    public void setIncludeGlobal(boolean includeGlobal) {
        this.includeGlobal = includeGlobal;
    }

    public boolean isTimings() {
        return timings;
    }

    public void setTimings(boolean timings) {
        this.timings = timings;
    }

    public List<String> getFallbackRegions() {
        return fallbackRegions;
    }

    public void setFallbackRegions(List<String> fallbackRegions) {
        if (fallbackRegions == null || fallbackRegions.isEmpty()) {
            return;
        }
        this.fallbackRegions = new ArrayList<>(fallbackRegions);
    }

    public ScanSettings getScan() {
        return scan;
    }

    public void setScan(ScanSettings scan) {
        this.scan = scan != null ? scan : new ScanSettings();
    }

    public CliSettings getCli() {
        return cli;
    }

    public void setCli(CliSettings cli) {
        this.cli = cli != null ? cli : new CliSettings();
    }
}
