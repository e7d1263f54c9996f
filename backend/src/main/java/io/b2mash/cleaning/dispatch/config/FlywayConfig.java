package io.b2mash.cleaning.dispatch.config;

import io.b2mash.cleaning.dispatch.booking.BookingProperties;
import io.b2mash.cleaning.dispatch.booking.enforcement.ConflictEnforcementMode;
import java.util.ArrayList;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Runs the schema migrations. The GiST exclusion constraint lives in its own location and is only
 * applied when the native enforcement mode is selected; the other modes run against engines (or
 * deployments) without range exclusion support.
 */
@Configuration
public class FlywayConfig {

  private static final Logger log = LoggerFactory.getLogger(FlywayConfig.class);

  static final String COMMON_LOCATION = "classpath:db/migration/common";
  static final String EXCLUSION_LOCATION = "classpath:db/migration/exclusion";

  @Bean(initMethod = "migrate")
  public Flyway flyway(
      @Qualifier("migrationDataSource") DataSource migrationDataSource,
      BookingProperties bookingProperties) {
    var locations = new ArrayList<String>();
    locations.add(COMMON_LOCATION);
    if (bookingProperties.conflictEnforcement()
        == ConflictEnforcementMode.NATIVE_EXCLUSION_CONSTRAINT) {
      locations.add(EXCLUSION_LOCATION);
    }
    log.info(
        "Configuring Flyway: enforcement={}, locations={}",
        bookingProperties.conflictEnforcement(),
        locations);

    return Flyway.configure()
        .dataSource(migrationDataSource)
        .locations(locations.toArray(String[]::new))
        .schemas("public")
        .baselineOnMigrate(true)
        .load();
  }
}
