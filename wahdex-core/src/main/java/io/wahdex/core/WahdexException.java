package io.wahdex.core;

public class WahdexException extends RuntimeException {

    public WahdexException(String message) {
        super(message);
    }

}
