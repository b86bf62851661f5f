package my.spendpilot.app.dto;

public record AuthResponse(String token, String tokenType, long expiresIn) {
}
