package io.b2mash.cleaning.dispatch.audit;

import io.b2mash.cleaning.dispatch.multitenancy.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder for {@link AuditEventRecord}. Fills in organization, actor, source, IP address and user
 * agent from the current request when they are not set explicitly.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("booking.created")
 *     .entityType("booking")
 *     .entityId(booking.getId())
 *     .details(Map.of("team_id", booking.getTeamId().toString()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID orgId;
  private String actor;
  private String source;
  private Map<String, Object> details;

  private boolean orgIdExplicitlySet;
  private boolean actorExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder orgId(UUID orgId) {
    this.orgId = orgId;
    this.orgIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder actor(String actor) {
    this.actor = actor;
    this.actorExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    UUID resolvedOrgId = orgIdExplicitlySet ? orgId : RequestScopes.getOrgIdOrNull();
    String resolvedActor = actorExplicitlySet ? actor : RequestScopes.getActorOrNull();
    String actorType = resolvedActor != null ? "USER" : "SYSTEM";

    HttpServletRequest request = resolveHttpRequest();
    String resolvedSource = source != null ? source : (request != null ? "API" : "INTERNAL");

    String ipAddress = null;
    String userAgent = null;
    if (request != null) {
      ipAddress = request.getRemoteAddr();
      userAgent = request.getHeader("User-Agent");
      if (userAgent != null && userAgent.length() > MAX_USER_AGENT_LENGTH) {
        userAgent = userAgent.substring(0, MAX_USER_AGENT_LENGTH);
      }
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        resolvedOrgId,
        resolvedActor,
        actorType,
        resolvedSource,
        ipAddress,
        userAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
