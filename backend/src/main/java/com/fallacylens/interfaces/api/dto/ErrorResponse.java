package com.fallacylens.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
