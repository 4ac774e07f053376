package com.prague.apartments.crawl.api;

import com.prague.apartments.crawl.service.ListingNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ListingExceptionHandler {

  @ExceptionHandler(ListingNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(ListingNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "listing_not_found", "message", ex.getMessage()));
  }
}
