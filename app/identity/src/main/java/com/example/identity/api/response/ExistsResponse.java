package com.example.identity.api.response;

public record ExistsResponse(boolean exists) {
}
