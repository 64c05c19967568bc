package com.companyintel.research;

public class ResearchPipelineException extends RuntimeException {
    private final String errorKey;

    public ResearchPipelineException(String errorKey, String message) {
        super(message);
        this.errorKey = errorKey;
    }

    public ResearchPipelineException(String errorKey, String message, Throwable cause) {
        super(message, cause);
        this.errorKey = errorKey;
    }

    public String getErrorKey() {
        return errorKey;
    }
}
