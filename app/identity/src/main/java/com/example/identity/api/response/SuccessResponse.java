package com.example.identity.api.response;

public record SuccessResponse(boolean success) {

    public static final SuccessResponse OK = new SuccessResponse(true);
}
