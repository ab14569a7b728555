package com.studentscheduler.backend.modules.user.presentation;

import com.studentscheduler.backend.modules.user.application.AccountService;
import com.studentscheduler.backend.modules.user.presentation.dto.LoginRequest;
import com.studentscheduler.backend.modules.user.presentation.dto.SignupRequest;
import com.studentscheduler.backend.modules.user.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AccountService accountService;

    public AuthController(AccountService accountService) {
        this.accountService = accountService;
    }

    @Operation(
            summary = "Register an account",
            description = """
                    Sets a password for the email. If schedules were already saved for the email, \
                    the existing user is claimed and keeps its schedules.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "409", description = "`EMAIL_ALREADY_REGISTERED`")
    })
    @PostMapping("/auth/signup")
    public ResponseEntity<UserProfileResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.status(201).body(
                accountService.signup(request.email(), request.name(), request.studentId(), request.password()));
    }

    @PostMapping("/auth/login")
    public ResponseEntity<UserProfileResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(accountService.login(request.email(), request.password()));
    }
}
