package com.yoursp.ledger.modules.reset.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class VerifyResetTokenRequest {

    @NotBlank(message = "token is required")
    private String token;
}
