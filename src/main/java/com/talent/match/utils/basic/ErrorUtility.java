package com.talent.match.utils.basic;

import com.talent.match.models.Error;
import org.springframework.http.HttpStatus;

public final class ErrorUtility {

    private ErrorUtility() {
        throw new UnsupportedOperationException("Not supported");
    }

    /**
     * Builds the error body returned by every failed API call.
     *
     * @param errorMsg the error msg
     * @param status   the status
     * @return the error
     */
    public static Error getError(String errorMsg, HttpStatus status) {
        return Error.builder()
                .errorMsg(errorMsg).uid(DefaultValuesPopulator.getUid())
                .status(status).timestamp(DefaultValuesPopulator.getCurrentTimestamp())
                .build();
    }
}
