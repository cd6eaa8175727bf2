package com.talent.match.exceptions;

import com.talent.match.models.Error;
import com.talent.match.utils.basic.ErrorUtility;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;


/**
 * Global exception handler for the match engine API.
 * <p>
 * Maps the engine's error taxonomy onto HTTP statuses. Timeouts and claim conflicts never reach
 * this class: they are absorbed inside the services that raise them.
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles {@link InvalidReferenceException} and returns a HTTP 404 Not Found response.
     *
     * @param e the {@link InvalidReferenceException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 404 status.
     */
    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<Error> handleInvalidReferenceException(InvalidReferenceException e) {
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.NOT_FOUND), HttpStatus.NOT_FOUND);
    }

    /**
     * Handles {@link BadRequestException} and returns a HTTP 400 Bad Request response with the error details.
     *
     * @param e the {@link BadRequestException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 400 status.
     */
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<Error> handleBadRequestException(BadRequestException e) {
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles {@link MethodArgumentNotValidException} and returns a HTTP 400 Bad Request response with validation errors.
     *
     * @param ex the {@link MethodArgumentNotValidException} to be handled.
     * @return a {@link ResponseEntity} containing the validation errors and a HTTP 400 status.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Error> handleValidationException(MethodArgumentNotValidException ex) {
        BindingResult bindingResult = ex.getBindingResult();
        StringBuilder errorMessage = new StringBuilder("Invalid request parameters:");

        for (FieldError fieldError : bindingResult.getFieldErrors()) {
            errorMessage.append(" Field '").append(fieldError.getField())
                    .append("' ").append(fieldError.getDefaultMessage()).append("; ");
        }
        return new ResponseEntity<>(ErrorUtility.getError(errorMessage.toString(), HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({ConstraintViolationException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Error> handleParameterException(RuntimeException e) {
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles {@link QueueOverflowException} raised by explicit enqueue requests and returns HTTP 503.
     *
     * @param e the {@link QueueOverflowException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 503 status.
     */
    @ExceptionHandler(QueueOverflowException.class)
    public ResponseEntity<Error> handleQueueOverflowException(QueueOverflowException e) {
        log.warn("Rejected request on overflowing queue: backlog={}, threshold={}", e.getBacklog(), e.getThreshold());
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.SERVICE_UNAVAILABLE), HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * Handles {@link InternalServerErrorException} and returns a HTTP 500 Internal Server Error response with the error details.
     *
     * @param e the {@link InternalServerErrorException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 500 status.
     */
    @ExceptionHandler(InternalServerErrorException.class)
    public ResponseEntity<Error> handleInternalServerErrorException(InternalServerErrorException e) {
        log.error("Internal error: {}", e.getMessage(), e);
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
