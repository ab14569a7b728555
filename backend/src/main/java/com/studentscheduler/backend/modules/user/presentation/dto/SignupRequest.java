package com.studentscheduler.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @NotBlank @Email @Size(max = 320) String email,
        @NotBlank @Size(max = 100) String name,
        @Size(max = 50) String studentId,
        @NotBlank @Size(min = 8, max = 128) String password
) {
}
