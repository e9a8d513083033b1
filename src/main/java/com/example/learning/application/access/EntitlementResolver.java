package com.example.learning.application.access;

import com.example.learning.entity.Course;
import com.example.learning.repository.EnrollmentRepository;
import com.example.learning.repository.PurchaseRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * (사용자, 코스) 쌍의 접근 등급을 판정한다. 부수 효과가 없는 읽기 전용 연산이다.
 *
 * 판정 순서 (먼저 일치하는 규칙이 이긴다)
 * 1. MANAGE_COURSES 권한 보유 -> ADMIN_PREVIEW
 * 2. 수강 등록 존재 -> ENROLLED_ACCESS
 * 3. 구매 기록 존재 -> PURCHASED_ACCESS
 * 4. 프리미엄 회원 -> PREMIUM_ACCESS
 * 5. 무료 코스 -> FREE_PREVIEW
 * 6. 그 외 -> NO_ACCESS
 */
@Service
@RequiredArgsConstructor
public class EntitlementResolver {

	private final PermissionResolver permissionResolver;
	private final EnrollmentRepository enrollmentRepository;
	private final PurchaseRepository purchaseRepository;

	@Transactional(readOnly = true)
	public AccessTier resolveEntitlement(UserIdentity user, Course course) {
		if (permissionResolver.hasCapability(user, Capability.MANAGE_COURSES)) {
			return AccessTier.ADMIN_PREVIEW;
		}
		if (!user.isAnonymous()) {
			if (enrollmentRepository.existsByUserIdAndCourseId(user.getId(), course.getId())) {
				return AccessTier.ENROLLED_ACCESS;
			}
			if (purchaseRepository.existsByUserIdAndCourseId(user.getId(), course.getId())) {
				return AccessTier.PURCHASED_ACCESS;
			}
			if (user.isPremium()) {
				return AccessTier.PREMIUM_ACCESS;
			}
		}
		if (course.isFree()) {
			return AccessTier.FREE_PREVIEW;
		}
		return AccessTier.NO_ACCESS;
	}
}
