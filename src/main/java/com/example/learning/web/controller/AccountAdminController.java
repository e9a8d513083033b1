package com.example.learning.web.controller;

import com.example.learning.application.access.PermissionResolver;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.service.AccountService;
import com.example.learning.application.service.EnrollmentService;
import com.example.learning.application.service.UserService;
import com.example.learning.entity.User;
import com.example.learning.web.controller.dto.EnrollmentResponse;
import com.example.learning.web.controller.dto.GrantCourseRequest;
import com.example.learning.web.controller.dto.PermissionLevelRequest;
import com.example.learning.web.controller.dto.PremiumRequest;
import com.example.learning.web.controller.dto.UserResponse;
import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/users")
@RequiredArgsConstructor
public class AccountAdminController {

	private final UserService userService;
	private final AccountService accountService;
	private final EnrollmentService enrollmentService;
	private final PermissionResolver permissionResolver;

	@GetMapping
	public ResponseEntity<List<UserResponse>> listUsers(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId) {
		UserIdentity caller = userService.loadCaller(callerId);
		List<UserResponse> users = accountService.listUsers(caller).stream()
			.map(this::toResponse)
			.collect(Collectors.toList());
		return ResponseEntity.ok(users);
	}

	@PutMapping("/{userId}/permissions")
	public ResponseEntity<UserResponse> changePermissionLevel(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable String userId,
		@Valid @RequestBody PermissionLevelRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		User user = accountService.changePermissionLevel(caller, userId, request.getPermissionLevel());
		return ResponseEntity.ok(toResponse(user));
	}

	@PutMapping("/{userId}/premium")
	public ResponseEntity<UserResponse> setPremium(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable String userId,
		@Valid @RequestBody PremiumRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		User user = accountService.setPremium(caller, userId, request.getPremium());
		return ResponseEntity.ok(toResponse(user));
	}

	/**
	 * 관리자 직권 수강 등록. 구매/구독 여부와 관계없이 수강 정보를 생성한다.
	 */
	@PostMapping("/{userId}/grant-course")
	public ResponseEntity<EnrollmentResponse> grantCourse(
		@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId,
		@PathVariable String userId,
		@Valid @RequestBody GrantCourseRequest request) {
		UserIdentity caller = userService.loadCaller(callerId);
		return ResponseEntity.ok(EnrollmentResponse.from(
			enrollmentService.grantCourseAccess(caller, userId, request.getCourseId())));
	}

	private UserResponse toResponse(User user) {
		return UserResponse.of(user, permissionResolver.resolvePermissions(UserIdentity.from(user)).asSet());
	}
}
