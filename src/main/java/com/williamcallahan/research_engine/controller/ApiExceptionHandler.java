/**
 * Maps exceptions raised by the run controllers to JSON error responses
 *
 * @author William Callahan
 */

package com.williamcallahan.research_engine.controller;

import com.williamcallahan.research_engine.controller.support.ErrorResponseUtils;
import com.williamcallahan.research_engine.service.RunNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleValidationExceptions(IllegalArgumentException ex) {
        logger.debug("Rejected request: {}", ex.getMessage());
        return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Bad request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.debug("Unreadable request body: {}", ex.getMessage());
        return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Bad request", "Request body is not valid JSON for this endpoint.");
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleRunNotFound(RunNotFoundException ex) {
        return ErrorResponseUtils.error(HttpStatus.NOT_FOUND, "Run not found", ex.getMessage());
    }
}
