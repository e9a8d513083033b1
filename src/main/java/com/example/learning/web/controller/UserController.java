package com.example.learning.web.controller;

import com.example.learning.application.access.PermissionResolver;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.exception.BusinessException;
import com.example.learning.application.service.UserService;
import com.example.learning.entity.User;
import com.example.learning.web.controller.dto.SignInRequest;
import com.example.learning.web.controller.dto.UserResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

	private final UserService userService;
	private final PermissionResolver permissionResolver;

	/**
	 * 외부 인증 완료 후 프로필 동기화. 최초 로그인 시 MEMBER 로 생성된다.
	 */
	@PostMapping("/sign-in")
	public ResponseEntity<UserResponse> signIn(@Valid @RequestBody SignInRequest request) {
		User user = userService.signIn(request);
		return ResponseEntity.ok(toResponse(user));
	}

	@GetMapping("/me")
	public ResponseEntity<UserResponse> me(@RequestHeader(value = CallerHeaders.USER_ID, required = false) String callerId) {
		UserIdentity caller = userService.loadCaller(callerId);
		if (caller.isAnonymous()) {
			throw BusinessException.notFound("사용자", null);
		}
		return ResponseEntity.ok(toResponse(userService.getUser(caller.getId())));
	}

	private UserResponse toResponse(User user) {
		return UserResponse.of(user, permissionResolver.resolvePermissions(UserIdentity.from(user)).asSet());
	}
}
