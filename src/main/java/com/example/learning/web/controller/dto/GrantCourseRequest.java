package com.example.learning.web.controller.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class GrantCourseRequest {
	@NotNull
	private Long courseId;
}
