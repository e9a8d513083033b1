package com.example.learning.web.controller.dto;

import com.example.learning.application.access.PermissionLevel;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PermissionLevelRequest {
	@NotNull
	private PermissionLevel permissionLevel;
}
