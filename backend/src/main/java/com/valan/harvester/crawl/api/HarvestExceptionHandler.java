package com.valan.harvester.crawl.api;

import com.valan.harvester.crawl.service.ActiveHarvestRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class HarvestExceptionHandler {

  @ExceptionHandler(ActiveHarvestRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveHarvestRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_harvest_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<Map<String, String>> handleUnavailable(IllegalStateException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "harvest_unavailable", "message", String.valueOf(ex.getMessage())));
  }
}
