package com.example.learning.web.controller.dto;

import com.example.learning.entity.LessonContentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class LessonRequest {
	@NotBlank
	private String title;
	private String description;
	private String content;
	@NotNull
	private LessonContentType contentType;
	private String videoUrl;
	@PositiveOrZero
	private Integer duration;
	private boolean published;
}
