package com.volunteermedia.notification;

public class GroupMeDeliveryException extends RuntimeException {

    public GroupMeDeliveryException(String message) {
        super(message);
    }

    public GroupMeDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
