package com.example.learning.application.service;

import com.example.learning.application.access.AccessTier;
import com.example.learning.application.access.EntitlementResolver;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.content.ContentVisibilityFilter;
import com.example.learning.application.exception.BusinessException;
import com.example.learning.application.exception.ErrorCode;
import com.example.learning.entity.Course;
import com.example.learning.entity.CourseModule;
import com.example.learning.entity.Enrollment;
import com.example.learning.entity.Lesson;
import com.example.learning.entity.LessonCompletion;
import com.example.learning.repository.CourseModuleRepository;
import com.example.learning.repository.CourseRepository;
import com.example.learning.repository.EnrollmentRepository;
import com.example.learning.repository.LessonCompletionRepository;
import com.example.learning.repository.LessonRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 레슨 완료 기록과 수강 진도율 재계산.
 *
 * 진도율 갱신은 (user, course) 수강 행을 PESSIMISTIC_WRITE 로 잠근 뒤 읽기-재계산-쓰기를 한 트랜잭션에서 수행한다.
 * 최초 완료 시 수강 행 생성이 경합하면 유니크 제약 위반이 나고, 재시도에서 먼저 생성된 행을 잠근다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressService {

	private final LessonRepository lessonRepository;
	private final CourseModuleRepository moduleRepository;
	private final CourseRepository courseRepository;
	private final EnrollmentRepository enrollmentRepository;
	private final LessonCompletionRepository completionRepository;
	private final EntitlementResolver entitlementResolver;
	private final ContentVisibilityFilter visibilityFilter;
	private final EnrollmentService enrollmentService;
	private final ProgressCalculator progressCalculator;

	@Retryable(
		retryFor = {DataIntegrityViolationException.class, ConcurrencyFailureException.class},
		maxAttempts = 3,
		backoff = @Backoff(delay = 50, maxDelay = 200, random = true)
	)
	@Transactional
	public Enrollment recordCompletion(UserIdentity caller, Long lessonId) {
		Lesson lesson = lessonRepository.findById(lessonId)
			.orElseThrow(() -> BusinessException.notFound("레슨", lessonId));
		CourseModule module = moduleRepository.findById(lesson.getModuleId())
			.orElseThrow(() -> BusinessException.notFound("모듈", lesson.getModuleId()));
		Course course = courseRepository.findById(module.getCourseId())
			.orElseThrow(() -> BusinessException.notFound("코스", module.getCourseId()));

		AccessTier tier = entitlementResolver.resolveEntitlement(caller, course);
		if (!tier.grantsAccess()) {
			throw BusinessException.accessDenied("이 코스에 접근할 수 없습니다.");
		}
		if (!visibilityFilter.isVisible(module, lesson)) {
			throw BusinessException.accessDenied("게시되지 않은 레슨은 완료 처리할 수 없습니다.");
		}
		if (caller.isAnonymous()) {
			throw new BusinessException(ErrorCode.ENROLLMENT_REQUIRED, "수강 등록이 필요합니다.");
		}

		String userId = caller.getId();
		Enrollment enrollment = enrollmentRepository.findForUpdate(userId, course.getId())
			.orElseGet(() -> enrollmentService.openEnrollment(userId, course));

		if (!completionRepository.existsByUserIdAndLessonId(userId, lessonId)) {
			LessonCompletion completion = new LessonCompletion();
			completion.setUserId(userId);
			completion.setLessonId(lessonId);
			completionRepository.saveAndFlush(completion);
			log.info("Lesson completed: lessonId: {}, userId: {}", lessonId, userId);
		}

		return recompute(enrollment, course);
	}

	/**
	 * 레슨 완료 표시를 취소한다. 완료 기록이 없으면 아무것도 하지 않는다.
	 */
	@Retryable(
		retryFor = ConcurrencyFailureException.class,
		maxAttempts = 3,
		backoff = @Backoff(delay = 50, maxDelay = 200, random = true)
	)
	@Transactional
	public Enrollment revokeCompletion(UserIdentity caller, Long lessonId) {
		Lesson lesson = lessonRepository.findById(lessonId)
			.orElseThrow(() -> BusinessException.notFound("레슨", lessonId));
		CourseModule module = moduleRepository.findById(lesson.getModuleId())
			.orElseThrow(() -> BusinessException.notFound("모듈", lesson.getModuleId()));
		Course course = courseRepository.findById(module.getCourseId())
			.orElseThrow(() -> BusinessException.notFound("코스", module.getCourseId()));
		if (caller.isAnonymous()) {
			throw new BusinessException(ErrorCode.ENROLLMENT_REQUIRED, "수강 등록이 필요합니다.");
		}

		Enrollment enrollment = enrollmentRepository.findForUpdate(caller.getId(), course.getId())
			.orElseThrow(() -> new BusinessException(ErrorCode.ENROLLMENT_REQUIRED, "수강 등록이 필요합니다."));
		int removed = completionRepository.deleteByUserIdAndLessonId(caller.getId(), lessonId);
		if (removed > 0) {
			log.info("Lesson completion revoked: lessonId: {}, userId: {}", lessonId, caller.getId());
		}
		return recompute(enrollment, course);
	}

	/**
	 * 수강 정보 조회. 구조 변경 뒤 아직 재계산되지 않았다면 읽기 전에 재계산한다.
	 */
	@Transactional
	public Enrollment getEnrollment(UserIdentity caller, Long courseId) {
		if (caller.isAnonymous()) {
			throw BusinessException.notFound("수강 정보", courseId);
		}
		Enrollment enrollment = enrollmentRepository.findForUpdate(caller.getId(), courseId)
			.orElseThrow(() -> BusinessException.notFound("수강 정보", courseId));
		return refreshIfStale(enrollment);
	}

	@Transactional
	public List<Enrollment> listEnrollments(UserIdentity caller) {
		if (caller.isAnonymous()) {
			return List.of();
		}
		List<Enrollment> enrollments = new ArrayList<>();
		for (Long courseId : enrollmentRepository.findCourseIdsByUserId(caller.getId())) {
			enrollmentRepository.findForUpdate(caller.getId(), courseId)
				.map(this::refreshIfStale)
				.ifPresent(enrollments::add);
		}
		return enrollments;
	}

	/**
	 * 수강 행을 잠그고 현재 게시 상태 기준으로 진도율을 다시 계산한다.
	 */
	@Transactional
	public Enrollment recomputeEnrollment(Long enrollmentId) {
		Enrollment enrollment = enrollmentRepository.findByIdForUpdate(enrollmentId)
			.orElseThrow(() -> BusinessException.notFound("수강 정보", enrollmentId));
		Course course = courseRepository.findById(enrollment.getCourseId())
			.orElseThrow(() -> BusinessException.notFound("코스", enrollment.getCourseId()));
		return recompute(enrollment, course);
	}

	private Enrollment refreshIfStale(Enrollment enrollment) {
		if (!enrollment.isProgressStale()) {
			return enrollment;
		}
		Course course = courseRepository.findById(enrollment.getCourseId())
			.orElseThrow(() -> BusinessException.notFound("코스", enrollment.getCourseId()));
		return recompute(enrollment, course);
	}

	private Enrollment recompute(Enrollment enrollment, Course course) {
		int progress = progressCalculator.calculate(enrollment.getUserId(), course);
		enrollment.applyProgress(progress, LocalDateTime.now());
		return enrollmentRepository.save(enrollment);
	}
}
