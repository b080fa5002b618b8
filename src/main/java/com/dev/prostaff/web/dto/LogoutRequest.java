package com.dev.prostaff.web.dto;

public record LogoutRequest(String refreshToken) {
}
