// wifi-feature-extractor-service/src/test/java/com/wifi/features/extractor/WifiFeatureExtractorApplicationTest.java

package com.wifi.features.extractor;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import com.wifi.features.extractor.adapter.DeviceFieldAdapterFactory;
import com.wifi.features.extractor.adapter.FieldLayout;
import com.wifi.features.extractor.config.properties.ElasticsearchConfigurationProperties;
import com.wifi.features.extractor.config.properties.KismetConfigurationProperties;
import com.wifi.features.extractor.scheduler.PollingScheduler;
import com.wifi.features.extractor.service.CollectionCycleService;

/**
 * Context test for the WiFi Feature Extractor Service. Polling is disabled by the test profile, so
 * no Kismet or Elasticsearch instance is needed.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class WifiFeatureExtractorApplicationTest {

  @Autowired private CollectionCycleService cycleService;

  @Autowired private PollingScheduler pollingScheduler;

  @Autowired private DeviceFieldAdapterFactory adapterFactory;

  @Autowired private KismetConfigurationProperties kismetProperties;

  @Autowired private ElasticsearchConfigurationProperties elasticsearchProperties;

  @Test
  void applicationContextLoads() {
    assertThat(cycleService).isNotNull();
    assertThat(pollingScheduler.isRunning()).isFalse();
  }

  @Test
  void shouldBindDefaultConfiguration() {
    assertThat(kismetProperties.windowSeconds()).isEqualTo(10);
    assertThat(kismetProperties.fieldLayout()).isEqualTo(FieldLayout.AUTO);
    assertThat(kismetProperties.requestTimeoutMs()).isEqualTo(5000L);
    assertThat(elasticsearchProperties.index()).isEqualTo("wids-wireless-features");
    assertThat(elasticsearchProperties.verifyCertificates()).isTrue();
    assertThat(elasticsearchProperties.hasPipeline()).isFalse();
    assertThat(elasticsearchProperties.hasCredentials()).isFalse();
  }

  @Test
  void shouldRegisterAdapterForEveryLayout() {
    for (FieldLayout layout : FieldLayout.values()) {
      assertThat(adapterFactory.getAdapter(layout).getLayout()).isEqualTo(layout);
    }
  }
}
