package com.example.learning.web.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;
import lombok.Data;

/**
 * null 인 필드는 변경하지 않는다.
 */
@Data
public class CourseUpdateRequest {
	private String title;
	private String description;
	private String category;
	private String level;
	@DecimalMin("0.00")
	private BigDecimal price;
	private Boolean free;
	private Boolean published;
}
