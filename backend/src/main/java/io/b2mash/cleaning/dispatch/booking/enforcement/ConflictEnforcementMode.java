package io.b2mash.cleaning.dispatch.booking.enforcement;

/** How overlap between active bookings of a team is prevented. */
public enum ConflictEnforcementMode {

  /** PostgreSQL GiST exclusion constraint plus the partial unique index. Full guarantee. */
  NATIVE_EXCLUSION_CONSTRAINT,

  /**
   * Locks the team row ({@code SELECT ... FOR UPDATE}) and checks for overlap inside the write
   * transaction. Full guarantee on engines without exclusion constraints, at the cost of serializing
   * writes per team.
   */
  SERIALIZED_TRANSACTION,

  /**
   * Checks for overlap inside the write transaction without locking. Exact-start duplicates are still
   * rejected by the unique index; concurrent overlapping requests can both succeed.
   */
  ADVISORY_ONLY;

  public boolean guaranteesNoOverlap() {
    return this != ADVISORY_ONLY;
  }
}
