package com.example.learning.web.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import lombok.Data;

@Data
public class CourseRequest {
	@NotBlank
	private String title;
	private String description;
	private String category;
	private String level;
	@DecimalMin("0.00")
	private BigDecimal price;
	private boolean free;
	private boolean published;
}
