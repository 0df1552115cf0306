package com.wifi.features.extractor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the WiFi Feature Extractor Service.
 *
 * <p>The service polls a Kismet wireless sensor for the devices it observed recently, turns every
 * device into a flat feature record and bulk-indexes the records into Elasticsearch for a
 * wireless intrusion detection system.
 *
 * <p><strong>Data Flow:</strong>
 *
 * <ol>
 *   <li>Fetch devices seen during the last polling window from the Kismet REST API
 *   <li>Extract identity, radio, timing and signal features per device
 *   <li>Deliver the batch with one Elasticsearch bulk request
 *   <li>Sleep for the polling interval and repeat
 * </ol>
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.wifi.features.extractor.config.properties")
public class WifiFeatureExtractorApplication {

  public static void main(String[] args) {
    SpringApplication.run(WifiFeatureExtractorApplication.class, args);
  }
}
