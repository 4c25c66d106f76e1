package de.htwsaar.ministream.common.serialization;

public class MiniStreamSerializationException extends RuntimeException {

    public MiniStreamSerializationException(String message) {

        super(message);
    }

    public MiniStreamSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
