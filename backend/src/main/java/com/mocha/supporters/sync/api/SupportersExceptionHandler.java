package com.mocha.supporters.sync.api;

import com.mocha.supporters.sync.assets.AssetStorageException;
import com.mocha.supporters.sync.assets.AvatarFetchException;
import com.mocha.supporters.sync.ledger.LedgerTransportException;
import com.mocha.supporters.sync.service.SyncAlreadyRunningException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SupportersExceptionHandler {

  @ExceptionHandler(SyncAlreadyRunningException.class)
  public ResponseEntity<Map<String, String>> handleActiveSync(SyncAlreadyRunningException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "sync_running", "message", ex.getMessage()));
  }

  @ExceptionHandler(LedgerTransportException.class)
  public ResponseEntity<Map<String, String>> handleLedgerFailure(LedgerTransportException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "ledger_unavailable", "message", ex.getMessage()));
  }

  @ExceptionHandler(AvatarFetchException.class)
  public ResponseEntity<Map<String, String>> handleAvatarFailure(AvatarFetchException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "avatar_unavailable", "message", ex.getMessage()));
  }

  @ExceptionHandler(AssetStorageException.class)
  public ResponseEntity<Map<String, String>> handleStorageFailure(AssetStorageException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "asset_storage_failed", "message", ex.getMessage()));
  }
}
