package com.companyintel.research.synthesis;

public class IntelligenceParseException extends Exception {

    public IntelligenceParseException(String message) {
        super(message);
    }

    public IntelligenceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
