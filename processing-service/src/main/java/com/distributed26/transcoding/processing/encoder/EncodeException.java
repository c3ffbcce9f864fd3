package com.distributed26.transcoding.processing.encoder;

public class EncodeException extends Exception {
    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
