package com.yoursp.ledger.modules.reset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class ResetPasswordRequest {

    @NotBlank(message = "token is required")
    private String token;

    @NotEmpty(message = "new_password is required")
    @JsonProperty("new_password")
    private String newPassword;
}
