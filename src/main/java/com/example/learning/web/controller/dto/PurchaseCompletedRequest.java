package com.example.learning.web.controller.dto;

import java.math.BigDecimal;
import lombok.Data;

/**
 * 결제 연동 측에서 전달하는 결제 완료 이벤트.
 */
@Data
public class PurchaseCompletedRequest {
	private String userId;
	private Long courseId;
	private BigDecimal amount;
}
