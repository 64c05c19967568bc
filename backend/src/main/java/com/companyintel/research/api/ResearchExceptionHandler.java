package com.companyintel.research.api;

import com.companyintel.research.DiscoveryExhaustedException;
import com.companyintel.research.PipelineCancelledException;
import com.companyintel.research.provider.ProviderUnavailableException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ResearchExceptionHandler {

  @ExceptionHandler(DiscoveryExhaustedException.class)
  public ResponseEntity<Map<String, String>> handleDiscoveryExhausted(DiscoveryExhaustedException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("error", ex.getErrorKey(), "message", ex.getMessage()));
  }

  @ExceptionHandler(ProviderUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleProviderUnavailable(ProviderUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", ex.getErrorKey(), "message", ex.getMessage()));
  }

  @ExceptionHandler(PipelineCancelledException.class)
  public ResponseEntity<Map<String, Object>> handleCancelled(PipelineCancelledException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.getErrorKey());
    body.put("message", ex.getMessage());
    body.put("stage", ex.getStage());
    body.put("partialBatch", ex.getPartialBatch());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }
}
