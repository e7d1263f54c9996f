package io.b2mash.cleaning.dispatch.config;

import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Two Hikari pools on the dispatch database. The {@code app} pool serves API requests with DML
 * rights only. Its connections bound lock waits with {@code booking.storage.lock-timeout}: a
 * booking write queued behind another transaction on the same team, or on an uncommitted booking
 * the exclusion constraint has to wait for, fails as a retryable 503 instead of holding the
 * request. The {@code migration} pool is Flyway's; it needs DDL rights and {@code CREATE
 * EXTENSION} and has no lock timeout.
 */
@Configuration
public class DataSourceConfig {

  private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

  @Bean(name = "appDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.app")
  public HikariDataSource appDataSource(
      @Value("${booking.storage.lock-timeout:5s}") Duration lockTimeout) {
    var dataSource = new HikariDataSource();
    dataSource.setConnectionInitSql(lockTimeoutStatement(lockTimeout));
    log.info("Booking connections use lock_timeout={}ms", lockTimeout.toMillis());
    return dataSource;
  }

  @Bean(name = "migrationDataSource")
  @ConfigurationProperties("spring.datasource.migration")
  public HikariDataSource migrationDataSource() {
    return new HikariDataSource();
  }

  static String lockTimeoutStatement(Duration lockTimeout) {
    if (lockTimeout.isNegative() || lockTimeout.isZero()) {
      throw new IllegalArgumentException("booking.storage.lock-timeout must be positive");
    }
    return "SET lock_timeout = " + lockTimeout.toMillis();
  }
}
