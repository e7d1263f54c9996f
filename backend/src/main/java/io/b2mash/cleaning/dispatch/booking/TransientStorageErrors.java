package io.b2mash.cleaning.dispatch.booking;

import io.b2mash.cleaning.dispatch.exception.StorageUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Classifies storage failures that say nothing about the data and may succeed on retry. A stale
 * optimistic-lock write is not one of them: the row changed underneath the caller, which is a
 * conflict.
 */
final class TransientStorageErrors {

  private TransientStorageErrors() {}

  static boolean isTransient(RuntimeException error) {
    if (error instanceof OptimisticLockingFailureException) {
      return false;
    }
    return error instanceof TransientDataAccessException
        || error instanceof RecoverableDataAccessException
        || error instanceof DataAccessResourceFailureException
        || error instanceof PessimisticLockingFailureException
        || error instanceof CannotCreateTransactionException;
  }

  static StorageUnavailableException unavailable(String operation, RuntimeException error) {
    return new StorageUnavailableException(
        operation + " failed due to a temporary storage problem; retry the request", error);
  }
}
