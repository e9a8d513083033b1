package com.example.learning.application.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

	@ExceptionHandler(BusinessException.class)
	public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
		ErrorCode code = ex.getErrorCode();
		return ResponseEntity.status(code.getStatus()).body(new ErrorResponse(code.name(), ex.getMessage()));
	}

	// 재시도 후에도 해소되지 않은 동시 변경 충돌
	@ExceptionHandler({ConcurrencyFailureException.class, DataIntegrityViolationException.class})
	public ResponseEntity<ErrorResponse> handleConflict(Exception ex) {
		log.warn("Concurrent modification could not be resolved: {}", ex.getMessage());
		return ResponseEntity.status(HttpStatus.CONFLICT)
			.body(new ErrorResponse(ErrorCode.CONFLICT.name(), "동시 변경이 감지되었습니다. 다시 시도해 주세요."));
	}

	@ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class,
		MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
	public ResponseEntity<ErrorResponse> handleInvalidRequest(Exception ex) {
		return ResponseEntity.status(HttpStatus.BAD_REQUEST)
			.body(new ErrorResponse(ErrorCode.INVALID_REQUEST.name(), "잘못된 요청입니다."));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ErrorResponse> handleException(Exception ex) {
		// 내부 불변식 위반 등 기타 모든 예외는 상세 내용을 숨기고 500 으로 응답
		log.error("Unhandled exception", ex);
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
			.body(new ErrorResponse("INTERNAL_ERROR", "Internal Server Error"));
	}
}
