package com.example.learning.application.service;

import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.exception.BusinessException;
import com.example.learning.application.exception.ErrorCode;
import com.example.learning.entity.Course;
import com.example.learning.entity.Purchase;
import com.example.learning.repository.CourseRepository;
import com.example.learning.repository.PurchaseRepository;
import com.example.learning.repository.UserRepository;
import com.example.learning.web.controller.dto.PurchaseCompletedRequest;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseService {

	private final PurchaseRepository purchaseRepository;
	private final UserRepository userRepository;
	private final CourseRepository courseRepository;

	/**
	 * 결제 완료 이벤트를 구매 기록으로 변환한다.
	 * 같은 (user, course) 이벤트가 다시 오면 기존 구매 기록을 그대로 돌려준다.
	 * 구매는 수강 등록을 만들지 않는다.
	 */
	@Retryable(
		retryFor = DataIntegrityViolationException.class,
		maxAttempts = 2,
		backoff = @Backoff(delay = 50)
	)
	@Transactional
	public Purchase recordPurchase(PurchaseCompletedRequest request) {
		if (request.getUserId() == null || request.getCourseId() == null) {
			throw new BusinessException(ErrorCode.INVALID_REQUEST, "userId 와 courseId 는 필수입니다.");
		}
		if (request.getAmount() == null || request.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
			throw new BusinessException(ErrorCode.INVALID_REQUEST, "결제 금액이 올바르지 않습니다.");
		}
		if (!userRepository.existsById(request.getUserId())) {
			throw BusinessException.notFound("사용자", request.getUserId());
		}
		Course course = courseRepository.findById(request.getCourseId())
			.orElseThrow(() -> BusinessException.notFound("코스", request.getCourseId()));
		if (course.isFree()) {
			throw new BusinessException(ErrorCode.INVALID_REQUEST, "무료 코스는 구매할 수 없습니다.");
		}

		Optional<Purchase> existing = purchaseRepository.findByUserIdAndCourseId(request.getUserId(), course.getId());
		if (existing.isPresent()) {
			log.info("Duplicate purchase event ignored for courseId: {}, userId: {}", course.getId(), request.getUserId());
			return existing.get();
		}

		Purchase purchase = new Purchase();
		purchase.setUserId(request.getUserId());
		purchase.setCourseId(course.getId());
		purchase.setAmount(request.getAmount());
		Purchase saved = purchaseRepository.saveAndFlush(purchase);
		log.info("Purchase recorded for courseId: {}, userId: {}, amount: {}", course.getId(), request.getUserId(), request.getAmount());
		return saved;
	}

	@Transactional(readOnly = true)
	public List<Purchase> listPurchases(UserIdentity caller) {
		if (caller.isAnonymous()) {
			return List.of();
		}
		return purchaseRepository.findByUserIdOrderByPurchasedAtDesc(caller.getId());
	}
}
