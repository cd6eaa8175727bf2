package com.talent.match.exceptions;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Raised when a student or listing id does not resolve to a marketplace record.
 * <p>
 * This is a client error: the id came from the caller, so it is reported as HTTP 404 and never retried.
 * </p>
 */
@Getter
@ResponseStatus(HttpStatus.NOT_FOUND)
public class InvalidReferenceException extends RuntimeException {
    private final String referenceType;
    private final UUID referenceId;

    public InvalidReferenceException(String referenceType, UUID referenceId) {
        super(referenceType + " " + referenceId + " does not exist");
        this.referenceType = referenceType;
        this.referenceId = referenceId;
    }

    public static InvalidReferenceException student(UUID studentId) {
        return new InvalidReferenceException("Student", studentId);
    }

    public static InvalidReferenceException listing(UUID listingId) {
        return new InvalidReferenceException("Listing", listingId);
    }
}
