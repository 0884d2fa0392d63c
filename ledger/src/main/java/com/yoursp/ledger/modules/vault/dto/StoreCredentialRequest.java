package com.yoursp.ledger.modules.vault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yoursp.ledger.model.entity.UserCredential;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class StoreCredentialRequest {

    @NotBlank(message = "user_id is required")
    @Size(max = UserCredential.MAX_USER_ID_LENGTH, message = "user_id is too long")
    @JsonProperty("user_id")
    private String userId;

    @NotEmpty(message = "username is required")
    private String username;

    @NotEmpty(message = "password is required")
    private String password;

    private String hint;
}
