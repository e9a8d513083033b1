package com.example.learning.web.controller;

import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.service.CourseService;
import com.example.learning.application.service.CourseStructureService;
import com.example.learning.application.service.UserService;
import com.example.learning.web.controller.dto.CourseRequest;
import com.example.learning.web.controller.dto.CourseResponse;
import com.example.learning.web.controller.dto.CourseUpdateRequest;
import com.example.learning.web.controller.dto.LessonRequest;
import com.example.learning.web.controller.dto.LessonResponse;
import com.example.learning.web.controller.dto.LessonUpdateRequest;
import com.example.learning.web.controller.dto.ModuleRequest;
import com.example.learning.web.controller.dto.ModuleResponse;
import com.example.learning.web.controller.dto.ModuleUpdateRequest;
import com.example.learning.web.controller.dto.ReorderRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 코스/모듈/레슨 관리. 모든 요청은 MANAGE_COURSES 권한을 확인한다.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class CourseAdminController {

	private final UserService userService;
	private final CourseService courseService;
	private final CourseStructureService structureService;

	@PostMapping("/courses")
	public ResponseEntity<CourseResponse> createCourse(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@Valid @RequestBody CourseRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.status(HttpStatus.CREATED)
			.body(CourseResponse.from(courseService.createCourse(caller, request)));
	}

	@PatchMapping("/courses/{courseId}")
	public ResponseEntity<CourseResponse> updateCourse(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long courseId,
		@Valid @RequestBody CourseUpdateRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.ok(CourseResponse.from(courseService.updateCourse(caller, courseId, request)));
	}

	// 모듈

	@PostMapping("/courses/{courseId}/modules")
	public ResponseEntity<ModuleResponse> createModule(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long courseId,
		@Valid @RequestBody ModuleRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.status(HttpStatus.CREATED)
			.body(ModuleResponse.from(structureService.createModule(caller, courseId, request)));
	}

	@PatchMapping("/modules/{moduleId}")
	public ResponseEntity<ModuleResponse> updateModule(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long moduleId,
		@Valid @RequestBody ModuleUpdateRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.ok(ModuleResponse.from(structureService.updateModule(caller, moduleId, request)));
	}

	@PutMapping("/modules/{moduleId}/reorder")
	public ResponseEntity<List<ModuleResponse>> reorderModule(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long moduleId,
		@Valid @RequestBody ReorderRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		List<ModuleResponse> modules = structureService.reorderModule(caller, moduleId, request.getNewIndex()).stream()
			.map(ModuleResponse::from)
			.collect(Collectors.toList());
		return ResponseEntity.ok(modules);
	}

	@DeleteMapping("/modules/{moduleId}")
	public ResponseEntity<Void> deleteModule(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long moduleId) {
		UserIdentity caller = userService.loadCaller(callerId);
		structureService.deleteModule(caller, moduleId);
		return ResponseEntity.noContent().build();
	}

	// 레슨

	@PostMapping("/modules/{moduleId}/lessons")
	public ResponseEntity<LessonResponse> createLesson(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long moduleId,
		@Valid @RequestBody LessonRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.status(HttpStatus.CREATED)
			.body(LessonResponse.from(structureService.createLesson(caller, moduleId, request)));
	}

	@PatchMapping("/lessons/{lessonId}")
	public ResponseEntity<LessonResponse> updateLesson(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long lessonId,
		@Valid @RequestBody LessonUpdateRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.ok(LessonResponse.from(structureService.updateLesson(caller, lessonId, request)));
	}

	@PutMapping("/lessons/{lessonId}/reorder")
	public ResponseEntity<List<LessonResponse>> reorderLesson(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long lessonId,
		@Valid @RequestBody ReorderRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		List<LessonResponse> lessons = structureService.reorderLesson(caller, lessonId, request.getNewIndex()).stream()
			.map(LessonResponse::from)
			.collect(Collectors.toList());
		return ResponseEntity.ok(lessons);
	}

	@DeleteMapping("/lessons/{lessonId}")
	public ResponseEntity<Void> deleteLesson(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable Long lessonId) {
		UserIdentity caller = userService.loadCaller(callerId);
		structureService.deleteLesson(caller, lessonId);
		return ResponseEntity.noContent().build();
	}
}
