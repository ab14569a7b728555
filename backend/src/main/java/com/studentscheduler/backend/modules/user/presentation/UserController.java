package com.studentscheduler.backend.modules.user.presentation;

import java.util.UUID;

import com.studentscheduler.backend.modules.user.application.AccountService;
import com.studentscheduler.backend.modules.user.application.UserResolver;
import com.studentscheduler.backend.modules.user.presentation.dto.ResolveUserRequest;
import com.studentscheduler.backend.modules.user.presentation.dto.ResolveUserResponse;
import com.studentscheduler.backend.modules.user.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserResolver userResolver;
    private final AccountService accountService;

    public UserController(UserResolver userResolver, AccountService accountService) {
        this.userResolver = userResolver;
        this.accountService = accountService;
    }

    @Operation(summary = "Get or create a user by email")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Existing or newly created user id"),
            @ApiResponse(responseCode = "422", description = "`EMAIL_REQUIRED` when no email can be derived"),
            @ApiResponse(responseCode = "503", description = "`DATABASE_UNAVAILABLE`, retry after the `Retry-After` delay")
    })
    @PostMapping
    public ResponseEntity<ResolveUserResponse> resolveUser(@Valid @RequestBody ResolveUserRequest request) {
        UUID userId = userResolver.resolveUser(request.identifier(), request.toHints());
        return ResponseEntity.ok(new ResolveUserResponse(userId));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> getUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(accountService.getProfile(userId));
    }
}
