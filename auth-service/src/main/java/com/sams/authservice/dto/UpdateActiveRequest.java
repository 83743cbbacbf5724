package com.sams.authservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateActiveRequest {
    @NotNull
    private Boolean active;
}
