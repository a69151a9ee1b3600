/*
 * Where: Relay infrastructure configuration
 * What: Builds the pooled SQLite DataSource from relay.store.path
 * Why: The store location is one operator setting; pool and pragma tuning stay under spring.datasource.hikari
 */
package com.example.relay.config;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StoreConfig {

  private static final Logger logger = LoggerFactory.getLogger(StoreConfig.class);
  private static final String SQLITE_DRIVER = "org.sqlite.JDBC";

  @Bean
  @ConfigurationProperties(prefix = "spring.datasource.hikari")
  public HikariDataSource dataSource(RelayStoreProperties storeProperties) {
    final String url = "jdbc:sqlite:" + storeProperties.path();
    logger.info("notification store path={}", storeProperties.path());
    return DataSourceBuilder.create()
        .type(HikariDataSource.class)
        .driverClassName(SQLITE_DRIVER)
        .url(url)
        .build();
  }
}
