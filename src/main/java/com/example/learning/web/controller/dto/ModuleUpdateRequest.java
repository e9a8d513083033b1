package com.example.learning.web.controller.dto;

import lombok.Data;

@Data
public class ModuleUpdateRequest {
	private String title;
	private String description;
	private Boolean published;
}
