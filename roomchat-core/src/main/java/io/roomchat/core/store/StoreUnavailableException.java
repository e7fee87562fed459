package io.roomchat.core.store;

import java.io.IOException;

public class StoreUnavailableException extends IOException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
