package com.example.learning.application.service;

import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.exception.BusinessException;
import com.example.learning.entity.User;
import com.example.learning.repository.UserRepository;
import com.example.learning.web.controller.dto.SignInRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

	private final UserRepository userRepository;

	/**
	 * 인증 제공자를 통한 로그인 시 사용자 레코드를 생성하거나 프로필 필드만 갱신한다.
	 * 권한 관련 필드(premium, admin, permissionLevel)는 여기서 바뀌지 않는다.
	 */
	@Transactional
	public User signIn(SignInRequest request) {
		User user = userRepository.findById(request.getId()).orElse(null);
		if (user == null) {
			user = new User();
			user.setId(request.getId());
			log.info("Creating user on first sign-in: {}", request.getId());
		}
		user.setEmail(request.getEmail());
		user.setFirstName(request.getFirstName());
		user.setLastName(request.getLastName());
		return userRepository.save(user);
	}

	/**
	 * 요청 헤더의 사용자 id 를 판정용 식별 정보로 변환한다. id 가 없으면 익명 사용자다.
	 */
	@Transactional(readOnly = true)
	public UserIdentity loadCaller(String callerId) {
		if (callerId == null || callerId.isBlank()) {
			return UserIdentity.ANONYMOUS;
		}
		return UserIdentity.from(getUser(callerId));
	}

	@Transactional(readOnly = true)
	public User getUser(String userId) {
		return userRepository.findById(userId)
			.orElseThrow(() -> BusinessException.notFound("사용자", userId));
	}
}
