package com.phoneauth.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting a phone login.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "phone": "+994 50 123 45 67"
 * }
 * </pre>
 *
 * National forms such as "050 123 45 67" are accepted and canonicalized
 * with the configured default region.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OtpRequest {

    @NotBlank(message = "Phone number is required")
    private String phone;
}
