package com.example.learning.application.service;

import com.example.learning.application.access.AccessTier;
import com.example.learning.application.access.Capability;
import com.example.learning.application.access.EntitlementResolver;
import com.example.learning.application.access.PermissionResolver;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.exception.BusinessException;
import com.example.learning.entity.Course;
import com.example.learning.entity.Enrollment;
import com.example.learning.repository.CourseRepository;
import com.example.learning.repository.EnrollmentRepository;
import com.example.learning.repository.UserRepository;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentService {

	private final EnrollmentRepository enrollmentRepository;
	private final CourseRepository courseRepository;
	private final UserRepository userRepository;
	private final EntitlementResolver entitlementResolver;
	private final PermissionResolver permissionResolver;
	private final ProgressCalculator progressCalculator;

	/**
	 * 명시적 수강 등록. 접근 등급이 NO_ACCESS 가 아니어야 한다.
	 * 이미 등록된 경우 기존 수강 정보를 그대로 돌려준다.
	 * 동시 등록으로 유니크 제약이 깨지면 재시도하여 먼저 생성된 수강 정보를 읽는다.
	 */
	@Retryable(
		retryFor = {DataIntegrityViolationException.class, ConcurrencyFailureException.class},
		maxAttempts = 3,
		backoff = @Backoff(delay = 50, maxDelay = 200, random = true)
	)
	@Transactional
	public Enrollment enroll(UserIdentity caller, Long courseId) {
		Course course = courseRepository.findById(courseId)
			.orElseThrow(() -> BusinessException.notFound("코스", courseId));
		if (caller.isAnonymous()) {
			throw BusinessException.forbidden("수강 등록에는 로그인이 필요합니다.");
		}

		Optional<Enrollment> existing = enrollmentRepository.findForUpdate(caller.getId(), courseId);
		if (existing.isPresent()) {
			return refreshIfStale(existing.get(), course);
		}

		AccessTier tier = entitlementResolver.resolveEntitlement(caller, course);
		if (!tier.grantsAccess()) {
			throw BusinessException.forbidden("구매가 필요한 코스입니다.");
		}
		return openEnrollment(caller.getId(), course);
	}

	/**
	 * 관리자에 의한 코스 접근 권한 부여. 접근 등급과 무관하게 수강 정보를 만든다.
	 */
	@Retryable(
		retryFor = {DataIntegrityViolationException.class, ConcurrencyFailureException.class},
		maxAttempts = 3,
		backoff = @Backoff(delay = 50, maxDelay = 200, random = true)
	)
	@Transactional
	public Enrollment grantCourseAccess(UserIdentity caller, String targetUserId, Long courseId) {
		if (!permissionResolver.hasCapability(caller, Capability.MANAGE_ACCOUNTS)) {
			throw BusinessException.forbidden("계정 관리 권한이 필요합니다.");
		}
		if (!userRepository.existsById(targetUserId)) {
			throw BusinessException.notFound("사용자", targetUserId);
		}
		Course course = courseRepository.findById(courseId)
			.orElseThrow(() -> BusinessException.notFound("코스", courseId));

		Optional<Enrollment> existing = enrollmentRepository.findForUpdate(targetUserId, courseId);
		if (existing.isPresent()) {
			return refreshIfStale(existing.get(), course);
		}
		log.info("Granting course access: courseId: {}, userId: {}, by {}", courseId, targetUserId, caller.getId());
		return openEnrollment(targetUserId, course);
	}

	/**
	 * 수강 정보 생성 및 코스 수강생 수 증가.
	 * 호출자는 (user, course) 수강 정보가 없음을 확인한 트랜잭션 안에서 호출해야 한다.
	 */
	@Transactional
	public Enrollment openEnrollment(String userId, Course course) {
		Enrollment enrollment = new Enrollment();
		enrollment.setUserId(userId);
		enrollment.setCourseId(course.getId());
		enrollment.applyProgress(progressCalculator.calculate(userId, course), LocalDateTime.now());
		Enrollment saved = enrollmentRepository.saveAndFlush(enrollment);

		courseRepository.incrementStudentCount(course.getId());
		log.info("Enrollment created for courseId: {}, userId: {}", course.getId(), userId);
		return saved;
	}

	private Enrollment refreshIfStale(Enrollment enrollment, Course course) {
		if (!enrollment.isProgressStale()) {
			return enrollment;
		}
		enrollment.applyProgress(progressCalculator.calculate(enrollment.getUserId(), course), LocalDateTime.now());
		return enrollmentRepository.save(enrollment);
	}
}
