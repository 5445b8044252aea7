package com.optiontrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/** Codes reported in the {@code error.code} field of a failed response. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    /** No bars have been stored for the symbol. */
    UNKNOWN_SYMBOL(HttpStatus.NOT_FOUND),
    /** Bars exist but are too few to produce a volatility rank. */
    INSUFFICIENT_HISTORY(HttpStatus.NOT_FOUND),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;
}
