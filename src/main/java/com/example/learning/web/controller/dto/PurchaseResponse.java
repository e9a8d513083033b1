package com.example.learning.web.controller.dto;

import com.example.learning.entity.Purchase;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Value;

@Value
public class PurchaseResponse {
	Long id;
	String userId;
	Long courseId;
	BigDecimal amount;
	LocalDateTime purchasedAt;

	public static PurchaseResponse from(Purchase purchase) {
		return new PurchaseResponse(purchase.getId(), purchase.getUserId(), purchase.getCourseId(),
			purchase.getAmount(), purchase.getPurchasedAt());
	}
}
