package com.chronoplan.core.portfolio;

/**
 * Thrown when a portfolio file cannot be read or parsed.
 */
public class PortfolioReadException extends RuntimeException {
    public PortfolioReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
