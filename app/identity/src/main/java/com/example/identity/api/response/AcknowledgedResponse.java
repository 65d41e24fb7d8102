package com.example.identity.api.response;

public record AcknowledgedResponse(boolean acknowledged) {

    public static final AcknowledgedResponse ACKNOWLEDGED = new AcknowledgedResponse(true);
}
