package io.b2mash.cleaning.dispatch.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DataSourceConfigTest {

  private final DataSourceConfig config = new DataSourceConfig();

  @Test
  void appPoolBoundsLockWaits() {
    try (var dataSource = config.appDataSource(Duration.ofSeconds(3))) {
      assertThat(dataSource.getConnectionInitSql()).isEqualTo("SET lock_timeout = 3000");
    }
  }

  @Test
  void migrationPoolHasNoLockTimeout() {
    try (var dataSource = config.migrationDataSource()) {
      assertThat(dataSource.getConnectionInitSql()).isNull();
    }
  }

  @Test
  void rejectsNonPositiveLockTimeout() {
    assertThatThrownBy(() -> DataSourceConfig.lockTimeoutStatement(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
