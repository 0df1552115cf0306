package com.wifi.features.extractor.config;

import java.time.Duration;

import javax.net.ssl.SSLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import com.wifi.features.extractor.config.properties.ElasticsearchConfigurationProperties;
import com.wifi.features.extractor.config.properties.KismetConfigurationProperties;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.netty.http.client.HttpClient;

/**
 * Configuration for the WebClients used to talk to Kismet and Elasticsearch. Each collaborator gets
 * its own client with its own base URL, credentials and timeouts.
 */
@Configuration
public class WebClientConfiguration {

  public static final String KISMET_WEB_CLIENT = "kismetWebClient";
  public static final String ELASTICSEARCH_WEB_CLIENT = "elasticsearchWebClient";

  private static final Logger logger = LoggerFactory.getLogger(WebClientConfiguration.class);

  /** Creates the WebClient for the Kismet REST API. */
  @Bean
  @Qualifier(KISMET_WEB_CLIENT)
  public WebClient kismetWebClient(KismetConfigurationProperties kismetProperties) {
    logger.info(
        "Configuring Kismet client: url={}, window={}s, layout={}",
        kismetProperties.baseUrl(),
        kismetProperties.windowSeconds(),
        kismetProperties.fieldLayout());

    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, kismetProperties.connectTimeoutMs())
            .responseTimeout(Duration.ofMillis(kismetProperties.requestTimeoutMs()));

    WebClient.Builder builder =
        WebClient.builder()
            .baseUrl(kismetProperties.baseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(
                configurer ->
                    configurer.defaultCodecs().maxInMemorySize(kismetProperties.maxResponseBytes()));

    if (kismetProperties.hasCredentials()) {
      builder.defaultHeaders(
          headers -> headers.setBasicAuth(kismetProperties.username(), kismetProperties.password()));
    }
    return builder.build();
  }

  /** Creates the WebClient for the Elasticsearch bulk API. */
  @Bean
  @Qualifier(ELASTICSEARCH_WEB_CLIENT)
  public WebClient elasticsearchWebClient(ElasticsearchConfigurationProperties esProperties) {
    logger.info(
        "Configuring Elasticsearch client: url={}, index={}, pipeline={}, verifyCertificates={}",
        esProperties.url(),
        esProperties.index(),
        esProperties.hasPipeline() ? esProperties.pipeline() : "<none>",
        esProperties.verifyCertificates());

    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, esProperties.connectTimeoutMs())
            .responseTimeout(Duration.ofMillis(esProperties.requestTimeoutMs()));

    if (!esProperties.verifyCertificates()) {
      logger.warn("TLS certificate verification is DISABLED for {}", esProperties.url());
      SslContext insecureContext = insecureSslContext();
      httpClient = httpClient.secure(spec -> spec.sslContext(insecureContext));
    }

    WebClient.Builder builder =
        WebClient.builder()
            .baseUrl(esProperties.url())
            .clientConnector(new ReactorClientHttpConnector(httpClient));

    if (esProperties.hasCredentials()) {
      builder.defaultHeaders(
          headers -> headers.setBasicAuth(esProperties.username(), esProperties.password()));
    }
    return builder.build();
  }

  private static SslContext insecureSslContext() {
    try {
      return SslContextBuilder.forClient()
          .trustManager(InsecureTrustManagerFactory.INSTANCE)
          .build();
    } catch (SSLException e) {
      throw new IllegalStateException("Failed to build TLS context for Elasticsearch client", e);
    }
  }
}
