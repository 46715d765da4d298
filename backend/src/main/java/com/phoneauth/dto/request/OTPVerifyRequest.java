package com.phoneauth.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for completing a phone login with the received code.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "phone": "+994501234567",
 *   "code": "482913"
 * }
 * </pre>
 *
 * @see com.phoneauth.dto.request.OtpRequest
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OTPVerifyRequest {

    @NotBlank(message = "Phone number is required")
    private String phone;

    /**
     * The numeric code sent to the phone. Only its hash is ever compared.
     */
    @NotBlank(message = "Code is required")
    private String code;
}
