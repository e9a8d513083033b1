package com.example.learning.web.controller.dto;

import com.example.learning.entity.LessonContentType;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class LessonUpdateRequest {
	private String title;
	private String description;
	private String content;
	private LessonContentType contentType;
	private String videoUrl;
	@PositiveOrZero
	private Integer duration;
	private Boolean published;
}
