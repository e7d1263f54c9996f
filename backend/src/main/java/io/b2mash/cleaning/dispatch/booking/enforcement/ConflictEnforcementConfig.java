package io.b2mash.cleaning.dispatch.booking.enforcement;

import io.b2mash.cleaning.dispatch.booking.AvailabilityChecker;
import io.b2mash.cleaning.dispatch.booking.BookingProperties;
import io.b2mash.cleaning.dispatch.team.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BookingProperties.class)
public class ConflictEnforcementConfig {

  private static final Logger log = LoggerFactory.getLogger(ConflictEnforcementConfig.class);

  @Bean
  public ConflictEnforcementStrategy conflictEnforcementStrategy(
      BookingProperties bookingProperties,
      TeamRepository teamRepository,
      AvailabilityChecker availabilityChecker) {
    var mode = bookingProperties.conflictEnforcement();
    if (!mode.guaranteesNoOverlap()) {
      log.warn(
          "Booking conflict enforcement is {}: overlapping bookings are only prevented on a"
              + " best-effort basis; exact duplicate starts are still rejected by the database",
          mode);
    } else {
      log.info("Booking conflict enforcement: {}", mode);
    }
    return switch (mode) {
      case NATIVE_EXCLUSION_CONSTRAINT -> new NativeExclusionConstraintStrategy();
      case SERIALIZED_TRANSACTION ->
          new SerializedTransactionStrategy(teamRepository, availabilityChecker);
      case ADVISORY_ONLY -> new AdvisoryOnlyStrategy(availabilityChecker);
    };
  }
}
