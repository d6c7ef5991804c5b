package com.apex.decisioncore.exception;

/**
 * Base failure for the decision core: unreadable state files, rejected audit records,
 * missing market data. Surfaces as 422 on the operator API.
 */
public class TradingException extends RuntimeException {

    public TradingException(String message) {
        super(message);
    }

    public TradingException(String message, Throwable cause) {
        super(message, cause);
    }
}
