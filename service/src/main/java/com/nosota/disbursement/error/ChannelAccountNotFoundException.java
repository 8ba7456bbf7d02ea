package com.nosota.disbursement.error;

public class ChannelAccountNotFoundException extends Exception {
    public ChannelAccountNotFoundException() {
    }

    public ChannelAccountNotFoundException(String message) {
        super(message);
    }

    public ChannelAccountNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public ChannelAccountNotFoundException(Throwable cause) {
        super(cause);
    }

    public ChannelAccountNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
