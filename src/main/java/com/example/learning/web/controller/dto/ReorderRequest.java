package com.example.learning.web.controller.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ReorderRequest {
	@NotNull
	private Integer newIndex;
}
