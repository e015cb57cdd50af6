package com.partshortage.exception;

import lombok.Getter;

@Getter
public abstract class PartShortageException extends RuntimeException {
    private final String errorCode;

    protected PartShortageException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected PartShortageException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
