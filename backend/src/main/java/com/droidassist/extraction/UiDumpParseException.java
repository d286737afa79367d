package com.droidassist.extraction;

public class UiDumpParseException extends RuntimeException {

    public UiDumpParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
