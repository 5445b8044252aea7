package com.optiontrader.exception;

import java.util.Map;

/** Request content that passed bean validation but cannot be processed. */
public class InvalidRequestException extends OptionTraderException {

    public InvalidRequestException(String message, Map<String, Object> details) {
        super(ErrorCode.BAD_REQUEST, message, details);
    }
}
