package com.example.learning.web.controller;

import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.service.PurchaseService;
import com.example.learning.application.service.UserService;
import com.example.learning.web.controller.dto.PurchaseCompletedRequest;
import com.example.learning.web.controller.dto.PurchaseResponse;
import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PurchaseController {

	private final UserService userService;
	private final PurchaseService purchaseService;

	/**
	 * 결제 시스템이 결제 완료를 통보하는 엔드포인트. 결제 승인 자체는 이 서비스에서 다루지 않는다.
	 */
	@PostMapping("/api/purchases/completed")
	public ResponseEntity<PurchaseResponse> purchaseCompleted(@Valid @RequestBody PurchaseCompletedRequest request) {
		return ResponseEntity.ok(PurchaseResponse.from(purchaseService.recordPurchase(request)));
	}

	@GetMapping("/api/users/me/purchases")
	public ResponseEntity<List<PurchaseResponse>> myPurchases(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId) {
		UserIdentity caller = userService.loadCaller(callerId);
		List<PurchaseResponse> purchases = purchaseService.listPurchases(caller).stream()
			.map(PurchaseResponse::from)
			.collect(Collectors.toList());
		return ResponseEntity.ok(purchases);
	}
}
