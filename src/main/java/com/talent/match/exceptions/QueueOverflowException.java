package com.talent.match.exceptions;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@Getter
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class QueueOverflowException extends RuntimeException {
    private final long backlog;
    private final long threshold;

    public QueueOverflowException(long backlog, long threshold) {
        super("Recomputation backlog " + backlog + " exceeds threshold " + threshold);
        this.backlog = backlog;
        this.threshold = threshold;
    }
}
