package com.example.dyncms.service;

import lombok.Getter;

public class CmsException extends RuntimeException {

    public enum Code {
        INVALID_DEFINITION,
        VALIDATION_FAILED,
        NOT_FOUND,
        CONFLICT,
        FORBIDDEN,
        UNAUTHENTICATED,
        INTERNAL
    }

    @Getter
    private final Code code;

    private CmsException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public static CmsException invalidDefinition(String message) {
        return new CmsException(Code.INVALID_DEFINITION, message);
    }

    public static CmsException validationFailed(String message) {
        return new CmsException(Code.VALIDATION_FAILED, message);
    }

    public static CmsException fieldRequired(String fieldName) {
        return new CmsException(Code.VALIDATION_FAILED, "Field '" + fieldName + "' is required");
    }

    public static CmsException contentTypeNotFound(String apiId) {
        return new CmsException(Code.NOT_FOUND, "Content type '" + apiId + "' not found");
    }

    public static CmsException entryNotFound(String apiId) {
        return new CmsException(Code.NOT_FOUND, "Content entry not found in '" + apiId + "'");
    }

    public static CmsException contentTypeAlreadyExists(String apiId) {
        return new CmsException(Code.CONFLICT,
                "A content type with API ID '" + apiId + "' already exists");
    }

    public static CmsException conflict(String message) {
        return new CmsException(Code.CONFLICT, message);
    }

    public static CmsException forbidden(String message) {
        return new CmsException(Code.FORBIDDEN, message);
    }

    public static CmsException unauthenticated() {
        return new CmsException(Code.UNAUTHENTICATED, "Authentication required");
    }
}
