package com.example.learning.application.exception;

import lombok.Value;

@Value
public class ErrorResponse {
	String code;
	String message;
}
