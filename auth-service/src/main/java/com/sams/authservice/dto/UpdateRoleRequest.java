package com.sams.authservice.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRoleRequest {
    /** Role value, e.g. {@code "admin"}. */
    @NotBlank
    private String role;
}
