package com.jobtrail.dedup.tracking.util;

import com.jobtrail.dedup.tracking.normalize.NormalizationException;
import com.jobtrail.dedup.tracking.service.ResolutionConflictException;
import com.jobtrail.dedup.tracking.service.StorageUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;

import java.util.Locale;

public final class RejectionReasons {
  public static final String MISSING_TITLE = "MISSING_TITLE";
  public static final String MISSING_COMPANY = "MISSING_COMPANY";
  public static final String MISSING_PLATFORM = "MISSING_PLATFORM";
  public static final String INVALID_RECORD = "INVALID_RECORD";
  public static final String CONFLICT = "CONFLICT";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String CANCELLED = "CANCELLED";
  public static final String STORAGE_UNAVAILABLE = "STORAGE_UNAVAILABLE";
  public static final String UNKNOWN = "UNKNOWN";

  private RejectionReasons() {}

  public static String fromMissingField(String field) {
    if (field == null || field.isBlank()) {
      return INVALID_RECORD;
    }
    return switch (field.toLowerCase(Locale.ROOT)) {
      case "title" -> MISSING_TITLE;
      case "company", "company_name", "companyname" -> MISSING_COMPANY;
      case "platform", "source_platform", "sourceplatform" -> MISSING_PLATFORM;
      default -> INVALID_RECORD;
    };
  }

  public static String fromException(Throwable error) {
    if (error == null) {
      return UNKNOWN;
    }
    if (error instanceof NormalizationException normalization) {
      return fromMissingField(normalization.getField());
    }
    if (error instanceof ResolutionConflictException) {
      return CONFLICT;
    }
    if (error instanceof DataIntegrityViolationException) {
      return CONFLICT;
    }
    if (error instanceof StorageUnavailableException
        || error instanceof DataAccessResourceFailureException
        || error instanceof TransientDataAccessResourceException) {
      return STORAGE_UNAVAILABLE;
    }
    if (error instanceof InterruptedException) {
      return CANCELLED;
    }
    return UNKNOWN;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case CONFLICT, TIMEOUT, CANCELLED, STORAGE_UNAVAILABLE -> true;
      default -> false;
    };
  }
}
