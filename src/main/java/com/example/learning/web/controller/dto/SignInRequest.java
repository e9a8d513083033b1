package com.example.learning.web.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SignInRequest {
	// 인증 제공자가 발급한 사용자 식별자
	@NotBlank
	private String id;
	private String email;
	private String firstName;
	private String lastName;
}
