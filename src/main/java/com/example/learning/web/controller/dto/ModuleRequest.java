package com.example.learning.web.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ModuleRequest {
	@NotBlank
	private String title;
	private String description;
	private boolean published;
}
