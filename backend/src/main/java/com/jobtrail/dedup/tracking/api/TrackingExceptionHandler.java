package com.jobtrail.dedup.tracking.api;

import com.jobtrail.dedup.tracking.service.ActiveIngestionRunException;
import com.jobtrail.dedup.tracking.service.InvalidCursorException;
import com.jobtrail.dedup.tracking.service.StorageUnavailableException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class TrackingExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(TrackingExceptionHandler.class);

  @ExceptionHandler(ActiveIngestionRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveIngestionRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_ingestion_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidCursorException.class)
  public ResponseEntity<Map<String, String>> handleInvalidCursor(InvalidCursorException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_cursor", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler({StorageUnavailableException.class, DataAccessResourceFailureException.class})
  public ResponseEntity<Map<String, String>> handleStorageUnavailable(RuntimeException ex) {
    log.warn("Request failed: tracking store unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "storage_unavailable", "message", String.valueOf(ex.getMessage())));
  }
}
