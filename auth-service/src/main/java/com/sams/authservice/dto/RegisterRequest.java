package com.sams.authservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Self-service registration")
public class RegisterRequest {

    @NotBlank
    @Size(max = 50)
    @Schema(description = "Username", example = "testuser")
    private String username;

    @NotBlank
    @Email
    @Size(max = 255)
    @Schema(description = "Email address, used to log in", example = "testuser@example.com")
    private String email;

    @NotBlank
    @ToString.Exclude
    @Schema(description = "Password", example = "TestPassword123!")
    private String password;
}
