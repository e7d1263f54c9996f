package io.b2mash.cleaning.dispatch.provisioning;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/orgs")
public class ProvisioningController {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningController.class);

  private final OrganizationProvisioningService provisioningService;

  public ProvisioningController(OrganizationProvisioningService provisioningService) {
    this.provisioningService = provisioningService;
  }

  @PostMapping("/provision")
  public ResponseEntity<ProvisioningResponse> provisionOrganization(
      @Valid @RequestBody ProvisioningRequest request) {
    log.info("Received provisioning request for org {}", request.clerkOrgId());

    var result = provisioningService.provision(request.clerkOrgId(), request.orgName());

    if (result.alreadyProvisioned()) {
      return ResponseEntity.status(HttpStatus.CONFLICT)
          .body(new ProvisioningResponse(result.orgId(), "Organization already provisioned"));
    }

    return ResponseEntity.created(URI.create("/internal/orgs/" + request.clerkOrgId()))
        .body(new ProvisioningResponse(result.orgId(), "Organization provisioned successfully"));
  }

  public record ProvisioningRequest(
      @NotBlank(message = "clerkOrgId is required") String clerkOrgId,
      @NotBlank(message = "orgName is required") String orgName) {}

  public record ProvisioningResponse(UUID orgId, String message) {}
}
