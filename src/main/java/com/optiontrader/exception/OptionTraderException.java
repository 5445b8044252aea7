package com.optiontrader.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Failure raised at the REST boundary and rendered by {@link GlobalExceptionHandler}.
 *
 * <p>The engines themselves never throw; controllers translate their null or invalid
 * results into one of the subclasses.
 */
@Getter
public abstract class OptionTraderException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected OptionTraderException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
