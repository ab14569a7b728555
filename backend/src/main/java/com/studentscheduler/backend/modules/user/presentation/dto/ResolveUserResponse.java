package com.studentscheduler.backend.modules.user.presentation.dto;

import java.util.UUID;

public record ResolveUserResponse(UUID userId) {
}
