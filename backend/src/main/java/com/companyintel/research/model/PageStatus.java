package com.companyintel.research.model;

public enum PageStatus {
    SUCCESS,
    EMPTY,
    FETCH_ERROR,
    EXTRACT_ERROR,
    TIMEOUT
}
