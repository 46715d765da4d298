package com.phoneauth.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phoneauth.service.LoginState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for authentication operations.
 *
 * Example JSON response for an OTP request:
 * <pre>
 * {
 *   "success": true,
 *   "message": "Verification code sent",
 *   "phone": "+9945******67",
 *   "loginState": "AWAITING_CODE",
 *   "expiresIn": 300,
 *   "attemptsAllowed": 3,
 *   "deliveryStatus": "SENT"
 * }
 * </pre>
 *
 * Example JSON response for verification or refresh:
 * <pre>
 * {
 *   "success": true,
 *   "message": "Authentication successful",
 *   "userId": "550e8400-e29b-41d4-a716-446655440000",
 *   "accessToken": "eyJhbGciOiJIUzI1NiIsImtpZCI6InByaW1hcnkifQ...",
 *   "refreshToken": "eyJhbGciOiJIUzI1NiIsImtpZCI6InByaW1hcnkifQ...",
 *   "expiresIn": 900,
 *   "refreshExpiresIn": 2592000,
 *   "loginState": "TOKEN_ISSUED"
 * }
 * </pre>
 *
 * Null fields are omitted. The code itself is never part of a response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {

    public static final String DELIVERY_SENT = "SENT";

    private boolean success;

    private String message;

    /**
     * Masked canonical phone number the code was sent to.
     */
    private String phone;

    private LoginState loginState;

    /**
     * Seconds until the code (OTP request) or the access token (verify, refresh) expires.
     */
    private Long expiresIn;

    private Integer attemptsAllowed;

    /**
     * "SENT", or "DISPATCH_FAILED" when the dispatcher could not deliver the
     * code. The code stays valid in both cases.
     */
    private String deliveryStatus;

    private String userId;

    private String accessToken;

    private String refreshToken;

    private Long refreshExpiresIn;
}
