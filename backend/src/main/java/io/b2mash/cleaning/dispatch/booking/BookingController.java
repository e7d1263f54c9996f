package io.b2mash.cleaning.dispatch.booking;

import io.b2mash.cleaning.dispatch.exception.ResourceConflictException;
import io.b2mash.cleaning.dispatch.multitenancy.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BookingController {

  private final BookingService bookingService;

  public BookingController(BookingService bookingService) {
    this.bookingService = bookingService;
  }

  @PostMapping("/api/bookings")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<BookingResponse> createBooking(
      @Valid @RequestBody CreateBookingRequest request) {
    var result =
        bookingService.createBooking(
            RequestScopes.requireOrgId(),
            new BookingService.NewBooking(
                request.teamId(),
                request.startsAt(),
                request.durationMinutes(),
                request.clientName(),
                request.serviceAddress(),
                request.notes(),
                request.leadId()));
    if (result instanceof BookingResult.Created created) {
      var booking = created.booking();
      return ResponseEntity.created(URI.create("/api/bookings/" + booking.getId()))
          .body(BookingResponse.from(booking));
    }
    throw slotUnavailable(result);
  }

  @GetMapping("/api/bookings/{id}")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<BookingResponse> getBooking(@PathVariable UUID id) {
    var booking = bookingService.getBooking(RequestScopes.requireOrgId(), id);
    return ResponseEntity.ok(BookingResponse.from(booking));
  }

  @GetMapping("/api/bookings")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<List<BookingResponse>> listBookings(
      @RequestParam UUID teamId, @RequestParam Instant from, @RequestParam Instant to) {
    var bookings = bookingService.listBookings(RequestScopes.requireOrgId(), teamId, from, to);
    return ResponseEntity.ok(bookings.stream().map(BookingResponse::from).toList());
  }

  @PatchMapping("/api/bookings/{id}/schedule")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<BookingResponse> rescheduleBooking(
      @PathVariable UUID id, @Valid @RequestBody RescheduleRequest request) {
    var result =
        bookingService.rescheduleBooking(
            RequestScopes.requireOrgId(), id, request.startsAt(), request.durationMinutes());
    if (result instanceof BookingResult.Rescheduled rescheduled) {
      return ResponseEntity.ok(BookingResponse.from(rescheduled.booking()));
    }
    throw slotUnavailable(result);
  }

  @PostMapping("/api/bookings/{id}/confirm")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<BookingResponse> confirmBooking(@PathVariable UUID id) {
    var booking = bookingService.confirmBooking(RequestScopes.requireOrgId(), id);
    return ResponseEntity.ok(BookingResponse.from(booking));
  }

  @PostMapping("/api/bookings/{id}/cancel")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<BookingResponse> cancelBooking(@PathVariable UUID id) {
    var booking = bookingService.cancelBooking(RequestScopes.requireOrgId(), id);
    return ResponseEntity.ok(BookingResponse.from(booking));
  }

  @PostMapping("/api/bookings/{id}/complete")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<BookingResponse> completeBooking(@PathVariable UUID id) {
    var booking = bookingService.completeBooking(RequestScopes.requireOrgId(), id);
    return ResponseEntity.ok(BookingResponse.from(booking));
  }

  @GetMapping("/api/teams/{teamId}/availability")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<AvailabilityResponse> getAvailability(
      @PathVariable UUID teamId,
      @RequestParam Instant startsAt,
      @RequestParam int durationMinutes) {
    var availability =
        bookingService.availability(
            RequestScopes.requireOrgId(), teamId, startsAt, durationMinutes);
    return ResponseEntity.ok(AvailabilityResponse.from(availability));
  }

  @GetMapping("/api/teams/{teamId}/slots")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<SlotsResponse> getSlots(
      @PathVariable UUID teamId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
      @RequestParam int durationMinutes,
      @RequestParam(required = false) UUID excludeBookingId) {
    var slots =
        bookingService.freeSlots(
            RequestScopes.requireOrgId(), teamId, date, durationMinutes, excludeBookingId);
    return ResponseEntity.ok(new SlotsResponse(date, durationMinutes, slots));
  }

  private static ResourceConflictException slotUnavailable(BookingResult result) {
    String detail =
        result instanceof BookingResult.SlotConflict conflict
            ? conflict.message()
            : BookingResult.SLOT_UNAVAILABLE;
    return ResourceConflictException.slotUnavailable(detail);
  }

  // --- DTOs ---

  public record CreateBookingRequest(
      @NotNull(message = "teamId is required") UUID teamId,
      @NotNull(message = "startsAt is required") Instant startsAt,
      @Min(value = 1, message = "durationMinutes must be positive") int durationMinutes,
      @Size(max = 255, message = "clientName must be at most 255 characters") String clientName,
      @Size(max = 500, message = "serviceAddress must be at most 500 characters")
          String serviceAddress,
      String notes,
      UUID leadId) {}

  public record RescheduleRequest(
      @NotNull(message = "startsAt is required") Instant startsAt,
      @Min(value = 1, message = "durationMinutes must be positive") int durationMinutes) {}

  public record BookingResponse(
      UUID id,
      UUID teamId,
      Instant startsAt,
      Instant endsAt,
      int durationMinutes,
      String status,
      String clientName,
      String serviceAddress,
      String notes,
      UUID leadId,
      Instant createdAt,
      Instant updatedAt,
      int version) {

    public static BookingResponse from(Booking booking) {
      return new BookingResponse(
          booking.getId(),
          booking.getTeamId(),
          booking.getStartsAt(),
          booking.getEndsAt(),
          booking.getDurationMinutes(),
          booking.getStatus().name(),
          booking.getClientName(),
          booking.getServiceAddress(),
          booking.getNotes(),
          booking.getLeadId(),
          booking.getCreatedAt(),
          booking.getUpdatedAt(),
          booking.getVersion());
    }
  }

  public record ConflictResponse(UUID id, Instant startsAt, Instant endsAt, String status) {

    public static ConflictResponse from(Booking booking) {
      return new ConflictResponse(
          booking.getId(),
          booking.getStartsAt(),
          booking.getEndsAt(),
          booking.getStatus().name());
    }
  }

  public record AvailabilityResponse(boolean available, List<ConflictResponse> conflicts) {

    public static AvailabilityResponse from(Availability availability) {
      return new AvailabilityResponse(
          availability.available(),
          availability.conflicts().stream().map(ConflictResponse::from).toList());
    }
  }

  public record SlotsResponse(LocalDate date, int durationMinutes, List<Instant> slots) {}
}
