package com.fallacylens.interfaces.api.dto;

public record FallacyTypeResponse(String kind, String definition, String educationalNote) {}
