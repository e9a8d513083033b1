package com.example.learning.web.controller;

import com.example.learning.application.access.AccessTier;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.content.FilteredTree;
import com.example.learning.application.service.CourseService;
import com.example.learning.application.service.EnrollmentService;
import com.example.learning.application.service.UserService;
import com.example.learning.web.controller.dto.AccessResponse;
import com.example.learning.web.controller.dto.CourseResponse;
import com.example.learning.web.controller.dto.EnrollmentResponse;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/courses")
@RequiredArgsConstructor
public class CourseController {

	private final UserService userService;
	private final CourseService courseService;
	private final EnrollmentService enrollmentService;

	@GetMapping
	public ResponseEntity<List<CourseResponse>> listCourses(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@RequestParam(defaultValue = "false") boolean includeDrafts) {
		UserIdentity caller = userService.loadCaller(callerId);
		List<CourseResponse> courses = courseService.listCourses(caller, includeDrafts).stream()
			.map(CourseResponse::from)
			.collect(Collectors.toList());
		return ResponseEntity.ok(courses);
	}

	@GetMapping("/free")
	public ResponseEntity<List<CourseResponse>> listFreeCourses() {
		return ResponseEntity.ok(courseService.listFreeCourses().stream()
			.map(CourseResponse::from)
			.collect(Collectors.toList()));
	}

	@GetMapping("/premium")
	public ResponseEntity<List<CourseResponse>> listPremiumCourses() {
		return ResponseEntity.ok(courseService.listPremiumCourses().stream()
			.map(CourseResponse::from)
			.collect(Collectors.toList()));
	}

	@GetMapping("/{courseId}")
	public ResponseEntity<CourseResponse> getCourse(@PathVariable Long courseId) {
		return ResponseEntity.ok(CourseResponse.from(courseService.getCourse(courseId)));
	}

	/**
	 * 모듈/레슨 구조. 요청자의 접근 등급에 따라 걸러진다.
	 */
	@GetMapping("/{courseId}/tree")
	public ResponseEntity<FilteredTree> getCourseTree(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long courseId) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.ok(courseService.getCourseTree(caller, courseId));
	}

	@GetMapping("/{courseId}/access")
	public ResponseEntity<AccessResponse> getAccess(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long courseId) {
		UserIdentity caller = userService.loadCaller(callerId);
		AccessTier tier = courseService.resolveAccess(caller, courseId);
		return ResponseEntity.ok(new AccessResponse(courseId, tier, tier.grantsAccess()));
	}

	@PostMapping("/{courseId}/enroll")
	public ResponseEntity<EnrollmentResponse> enroll(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long courseId) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.ok(EnrollmentResponse.from(enrollmentService.enroll(caller, courseId)));
	}
}
