package com.wifi.features.extractor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * DTO representing one feature document derived from a Kismet device observation.
 * 
 * This is the unit written to the Elasticsearch index. Absent values are serialized as
 * explicit nulls so every document carries the complete schema.
 */
public record FeatureRecord(
    // Document Time
    @JsonProperty("@timestamp")
    Instant timestamp,
    
    // Sensor Identity
    @JsonProperty("sensor_id")
    String sensorId,
    @JsonProperty("sensor_site")
    String sensorSite,
    
    // Network Identity
    @JsonProperty("bssid")
    String bssid,
    @JsonProperty("ssid")
    String ssid,
    @JsonProperty("ssid_entropy")
    double ssidEntropy,
    
    // Descriptive Attributes (passed through as reported by Kismet)
    @JsonProperty("manufacturer")
    Object manufacturer,
    @JsonProperty("channel")
    Object channel,
    @JsonProperty("phy_type")
    Object phyType,
    
    // Observation Window
    @JsonProperty("first_seen")
    Instant firstSeen,
    @JsonProperty("last_seen")
    Instant lastSeen,
    
    // Signal Statistics (dBm)
    @JsonProperty("rssi_last")
    Number rssiLast,
    @JsonProperty("rssi_min")
    Number rssiMin,
    @JsonProperty("rssi_max")
    Number rssiMax,
    @JsonProperty("rssi_mean")
    Number rssiMean,
    
    // Association
    @JsonProperty("client_count")
    int clientCount,
    
    // Reserved, not computed yet
    @JsonProperty("deauth_count_approx")
    Integer deauthCountApprox,
    @JsonProperty("probe_req_count_approx")
    Integer probeReqCountApprox
) {
    
    /**
     * Builder pattern for creating feature records.
     */
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Builder class for constructing FeatureRecord instances. The reserved counters cannot be
     * set and are always null.
     */
    public static class Builder {
        private Instant timestamp;
        
        private String sensorId;
        private String sensorSite;
        
        private String bssid;
        private String ssid;
        private double ssidEntropy;
        
        private Object manufacturer;
        private Object channel;
        private Object phyType;
        
        private Instant firstSeen;
        private Instant lastSeen;
        
        private Number rssiLast;
        private Number rssiMin;
        private Number rssiMax;
        private Number rssiMean;
        
        private int clientCount;
        
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }
        
        public Builder sensorId(String sensorId) {
            this.sensorId = sensorId;
            return this;
        }
        
        public Builder sensorSite(String sensorSite) {
            this.sensorSite = sensorSite;
            return this;
        }
        
        public Builder bssid(String bssid) {
            this.bssid = bssid;
            return this;
        }
        
        public Builder ssid(String ssid) {
            this.ssid = ssid;
            return this;
        }
        
        public Builder ssidEntropy(double ssidEntropy) {
            this.ssidEntropy = ssidEntropy;
            return this;
        }
        
        public Builder manufacturer(Object manufacturer) {
            this.manufacturer = manufacturer;
            return this;
        }
        
        public Builder channel(Object channel) {
            this.channel = channel;
            return this;
        }
        
        public Builder phyType(Object phyType) {
            this.phyType = phyType;
            return this;
        }
        
        public Builder firstSeen(Instant firstSeen) {
            this.firstSeen = firstSeen;
            return this;
        }
        
        public Builder lastSeen(Instant lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }
        
        public Builder rssiLast(Number rssiLast) {
            this.rssiLast = rssiLast;
            return this;
        }
        
        public Builder rssiMin(Number rssiMin) {
            this.rssiMin = rssiMin;
            return this;
        }
        
        public Builder rssiMax(Number rssiMax) {
            this.rssiMax = rssiMax;
            return this;
        }
        
        public Builder rssiMean(Number rssiMean) {
            this.rssiMean = rssiMean;
            return this;
        }
        
        public Builder clientCount(int clientCount) {
            this.clientCount = clientCount;
            return this;
        }
        
        public FeatureRecord build() {
            return new FeatureRecord(
                timestamp, sensorId, sensorSite,
                bssid, ssid, ssidEntropy,
                manufacturer, channel, phyType,
                firstSeen, lastSeen,
                rssiLast, rssiMin, rssiMax, rssiMean,
                clientCount,
                null, null
            );
        }
    }
}
