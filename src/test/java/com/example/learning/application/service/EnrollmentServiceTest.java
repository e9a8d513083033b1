package com.example.learning.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.learning.application.access.AccessTier;
import com.example.learning.application.access.EntitlementResolver;
import com.example.learning.application.access.PermissionLevel;
import com.example.learning.application.access.PermissionResolver;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.exception.BusinessException;
import com.example.learning.application.exception.ErrorCode;
import com.example.learning.entity.Course;
import com.example.learning.entity.Enrollment;
import com.example.learning.repository.CourseRepository;
import com.example.learning.repository.EnrollmentRepository;
import com.example.learning.repository.UserRepository;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EnrollmentServiceTest {

	@Mock
	private EnrollmentRepository enrollmentRepository;

	@Mock
	private CourseRepository courseRepository;

	@Mock
	private UserRepository userRepository;

	@Mock
	private EntitlementResolver entitlementResolver;

	@Mock
	private ProgressCalculator progressCalculator;

	private EnrollmentService enrollmentService;

	private Course course;

	private final Long courseId = 1L;
	private final UserIdentity member = UserIdentity.of("u1", false, false, PermissionLevel.MEMBER);

	@BeforeEach
	void setUp() {
		enrollmentService = new EnrollmentService(enrollmentRepository, courseRepository, userRepository,
			entitlementResolver, new PermissionResolver(), progressCalculator);
		course = new Course();
		course.setId(courseId);
		course.setFree(true);
	}

	// =========================
	// 수강 등록
	// =========================

	// 성공 케이스: 무료 코스 등록 시 수강 정보 생성 및 수강생 수 증가
	@Test
	void testEnroll_success() {
		when(courseRepository.findById(courseId)).thenReturn(Optional.of(course));
		when(enrollmentRepository.findForUpdate("u1", courseId)).thenReturn(Optional.empty());
		when(entitlementResolver.resolveEntitlement(member, course)).thenReturn(AccessTier.FREE_PREVIEW);
		when(progressCalculator.calculate("u1", course)).thenReturn(0);
		when(enrollmentRepository.saveAndFlush(any(Enrollment.class))).thenAnswer(invocation -> invocation.getArgument(0));

		Enrollment enrollment = enrollmentService.enroll(member, courseId);

		assertEquals("u1", enrollment.getUserId());
		assertEquals(courseId, enrollment.getCourseId());
		assertEquals(0, enrollment.getProgress());
		verify(courseRepository, times(1)).incrementStudentCount(courseId);
	}

	// 이미 등록된 경우 기존 수강 정보를 그대로 반환 (수강생 수 변화 없음)
	@Test
	void testEnroll_alreadyEnrolledIsIdempotent() {
		Enrollment existing = new Enrollment();
		existing.setUserId("u1");
		existing.setCourseId(courseId);
		existing.setProgress(40);
		when(courseRepository.findById(courseId)).thenReturn(Optional.of(course));
		when(enrollmentRepository.findForUpdate("u1", courseId)).thenReturn(Optional.of(existing));

		Enrollment enrollment = enrollmentService.enroll(member, courseId);

		assertSame(existing, enrollment);
		verify(courseRepository, never()).incrementStudentCount(anyLong());
		verify(enrollmentRepository, never()).saveAndFlush(any());
	}

	// 실패 케이스: 유료 코스를 구매 없이 등록
	@Test
	void testEnroll_failure_noAccess() {
		course.setFree(false);
		when(courseRepository.findById(courseId)).thenReturn(Optional.of(course));
		when(enrollmentRepository.findForUpdate("u1", courseId)).thenReturn(Optional.empty());
		when(entitlementResolver.resolveEntitlement(member, course)).thenReturn(AccessTier.NO_ACCESS);

		BusinessException exception = assertThrows(BusinessException.class, () -> enrollmentService.enroll(member, courseId));

		assertEquals(ErrorCode.FORBIDDEN, exception.getErrorCode());
		verify(enrollmentRepository, never()).saveAndFlush(any());
	}

	@Test
	void testEnroll_failure_anonymous() {
		when(courseRepository.findById(courseId)).thenReturn(Optional.of(course));

		BusinessException exception = assertThrows(BusinessException.class,
			() -> enrollmentService.enroll(UserIdentity.ANONYMOUS, courseId));

		assertEquals(ErrorCode.FORBIDDEN, exception.getErrorCode());
	}

	@Test
	void testEnroll_failure_courseNotFound() {
		when(courseRepository.findById(courseId)).thenReturn(Optional.empty());

		BusinessException exception = assertThrows(BusinessException.class, () -> enrollmentService.enroll(member, courseId));

		assertEquals(ErrorCode.NOT_FOUND, exception.getErrorCode());
	}

	// =========================
	// 관리자 직권 등록
	// =========================

	@Test
	void testGrantCourseAccess_success() {
		UserIdentity superAdmin = UserIdentity.of("root", false, false, PermissionLevel.SUPER_ADMIN);
		course.setFree(false);
		when(userRepository.existsById("u1")).thenReturn(true);
		when(courseRepository.findById(courseId)).thenReturn(Optional.of(course));
		when(enrollmentRepository.findForUpdate("u1", courseId)).thenReturn(Optional.empty());
		when(progressCalculator.calculate("u1", course)).thenReturn(0);
		when(enrollmentRepository.saveAndFlush(any(Enrollment.class))).thenAnswer(invocation -> invocation.getArgument(0));

		Enrollment enrollment = enrollmentService.grantCourseAccess(superAdmin, "u1", courseId);

		assertEquals("u1", enrollment.getUserId());
		verify(entitlementResolver, never()).resolveEntitlement(any(), any());
	}

	// 코스 관리자는 계정 관리 권한이 없으므로 직권 등록 불가
	@Test
	void testGrantCourseAccess_failure_requiresManageAccounts() {
		UserIdentity courseAdmin = UserIdentity.of("c1", false, false, PermissionLevel.COURSE_ADMIN);

		BusinessException exception = assertThrows(BusinessException.class,
			() -> enrollmentService.grantCourseAccess(courseAdmin, "u1", courseId));

		assertEquals(ErrorCode.FORBIDDEN, exception.getErrorCode());
		verify(userRepository, never()).existsById(any());
	}
}
