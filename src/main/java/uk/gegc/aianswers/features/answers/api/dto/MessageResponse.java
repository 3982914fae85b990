package uk.gegc.aianswers.features.answers.api.dto;

public record MessageResponse(boolean success, String message) {
}
