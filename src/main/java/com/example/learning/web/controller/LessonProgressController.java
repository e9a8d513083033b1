package com.example.learning.web.controller;

import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.service.ProgressService;
import com.example.learning.application.service.UserService;
import com.example.learning.web.controller.dto.EnrollmentResponse;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class LessonProgressController {

	private final UserService userService;
	private final ProgressService progressService;

	/**
	 * 레슨 완료 기록. 같은 레슨을 다시 완료해도 진도율은 변하지 않는다.
	 */
	@PostMapping("/api/lessons/{lessonId}/complete")
	public ResponseEntity<EnrollmentResponse> complete(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long lessonId) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.ok(EnrollmentResponse.from(progressService.recordCompletion(caller, lessonId)));
	}

	@DeleteMapping("/api/lessons/{lessonId}/complete")
	public ResponseEntity<EnrollmentResponse> revoke(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long lessonId) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.ok(EnrollmentResponse.from(progressService.revokeCompletion(caller, lessonId)));
	}

	@GetMapping("/api/users/me/enrollments")
	public ResponseEntity<List<EnrollmentResponse>> myEnrollments(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId) {
		UserIdentity caller = userService.loadCaller(callerId);
		List<EnrollmentResponse> enrollments = progressService.listEnrollments(caller).stream()
			.map(EnrollmentResponse::from)
			.collect(Collectors.toList());
		return ResponseEntity.ok(enrollments);
	}

	@GetMapping("/api/users/me/enrollments/{courseId}")
	public ResponseEntity<EnrollmentResponse> myEnrollment(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long courseId) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.ok(EnrollmentResponse.from(progressService.getEnrollment(caller, courseId)));
	}
}
