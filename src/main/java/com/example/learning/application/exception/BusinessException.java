package com.example.learning.application.exception;

import lombok.Getter;

@Getter
public class BusinessException extends RuntimeException {

	private final ErrorCode errorCode;

	public BusinessException(ErrorCode errorCode, String message) {
		super(message);
		this.errorCode = errorCode;
	}

	public static BusinessException notFound(String what, Object id) {
		return new BusinessException(ErrorCode.NOT_FOUND, what + "을(를) 찾을 수 없습니다. id=" + id);
	}

	public static BusinessException forbidden(String message) {
		return new BusinessException(ErrorCode.FORBIDDEN, message);
	}

	public static BusinessException accessDenied(String message) {
		return new BusinessException(ErrorCode.ACCESS_DENIED, message);
	}
}
