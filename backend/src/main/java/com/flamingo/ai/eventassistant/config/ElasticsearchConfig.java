package com.flamingo.ai.eventassistant.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import co.elastic.clients.transport.rest5_client.low_level.Rest5ClientBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Client for the Elasticsearch cluster holding the event catalog. The assistant only reads from
 * it; the events, summaries and collections indices are written by the ingestion side.
 */
@Configuration
@Slf4j
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Value("${elasticsearch.api-key:}")
  private String apiKey;

  @Bean
  public Rest5Client rest5Client() {
    log.info("Event catalog at {}://{}:{}", scheme, host, port);
    Rest5ClientBuilder builder = Rest5Client.builder(new HttpHost(scheme, host, port));
    if (apiKey != null && !apiKey.isBlank()) {
      builder.setDefaultHeaders(
          new Header[] {new BasicHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + apiKey)});
    }
    return builder.build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(Rest5Client rest5Client) {
    // Catalog documents carry ISO dates
    ObjectMapper mapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper(mapper));
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }
}
