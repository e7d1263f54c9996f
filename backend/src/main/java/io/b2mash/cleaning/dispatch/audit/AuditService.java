package io.b2mash.cleaning.dispatch.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads audit events. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   */
  void log(AuditEventRecord record);

  /** Audit trail of one entity, oldest first. */
  List<AuditEvent> findByEntity(String entityType, UUID entityId);
}
