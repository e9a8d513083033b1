package com.example.learning.application.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

	// 접근 등급이 요청한 콘텐츠/행위에 부족함
	ACCESS_DENIED(HttpStatus.FORBIDDEN),

	// 관리 기능 권한 없음
	FORBIDDEN(HttpStatus.FORBIDDEN),

	// 수강 등록(또는 등록 가능한 식별자) 없이 진도 기록 시도
	ENROLLMENT_REQUIRED(HttpStatus.FORBIDDEN),

	NOT_FOUND(HttpStatus.NOT_FOUND),

	// 재정렬 대상 인덱스 범위 초과
	INVALID_ORDER(HttpStatus.BAD_REQUEST),

	INVALID_REQUEST(HttpStatus.BAD_REQUEST),

	// 동시 변경 충돌, 호출자가 재시도해야 함
	CONFLICT(HttpStatus.CONFLICT);

	private final HttpStatus status;

	ErrorCode(HttpStatus status) {
		this.status = status;
	}

	public HttpStatus getStatus() {
		return status;
	}
}
