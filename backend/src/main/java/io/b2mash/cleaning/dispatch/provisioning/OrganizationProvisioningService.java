package io.b2mash.cleaning.dispatch.provisioning;

import io.b2mash.cleaning.dispatch.audit.AuditEventBuilder;
import io.b2mash.cleaning.dispatch.audit.AuditService;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Registers organizations coming from the identity provider. Repeated calls for the same org ID
 * return the existing record instead of failing.
 */
@Service
public class OrganizationProvisioningService {

  private static final Logger log = LoggerFactory.getLogger(OrganizationProvisioningService.class);

  private final OrganizationRepository organizationRepository;
  private final AuditService auditService;
  private final TransactionTemplate transactionTemplate;

  public OrganizationProvisioningService(
      OrganizationRepository organizationRepository,
      AuditService auditService,
      TransactionTemplate transactionTemplate) {
    this.organizationRepository = organizationRepository;
    this.auditService = auditService;
    this.transactionTemplate = transactionTemplate;
  }

  public ProvisioningResult provision(String clerkOrgId, String orgName) {
    var existing = organizationRepository.findByClerkOrgId(clerkOrgId);
    if (existing.isPresent()) {
      log.info("Organization already provisioned for org {}", clerkOrgId);
      return ProvisioningResult.alreadyProvisioned(existing.get().getId());
    }

    try {
      Organization org = transactionTemplate.execute(status -> insert(clerkOrgId, orgName));
      log.info("Provisioned organization {} for org {}", org.getId(), clerkOrgId);
      return ProvisioningResult.success(org.getId());
    } catch (DataIntegrityViolationException ex) {
      // Concurrent provisioning of the same org won the unique constraint
      UUID orgId =
          organizationRepository
              .findByClerkOrgId(clerkOrgId)
              .map(Organization::getId)
              .orElseThrow(() -> ex);
      log.info("Organization for org {} was provisioned concurrently", clerkOrgId);
      return ProvisioningResult.alreadyProvisioned(orgId);
    }
  }

  private Organization insert(String clerkOrgId, String orgName) {
    var org = organizationRepository.saveAndFlush(new Organization(clerkOrgId, orgName));
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("organization.provisioned")
            .entityType("organization")
            .entityId(org.getId())
            .orgId(org.getId())
            .actor(null)
            .details(Map.of("clerk_org_id", clerkOrgId, "name", orgName))
            .build());
    return org;
  }

  public record ProvisioningResult(UUID orgId, boolean alreadyProvisioned) {

    public static ProvisioningResult success(UUID orgId) {
      return new ProvisioningResult(orgId, false);
    }

    public static ProvisioningResult alreadyProvisioned(UUID orgId) {
      return new ProvisioningResult(orgId, true);
    }
  }
}
