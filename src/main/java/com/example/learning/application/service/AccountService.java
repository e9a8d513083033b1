package com.example.learning.application.service;

import com.example.learning.application.access.Capability;
import com.example.learning.application.access.PermissionLevel;
import com.example.learning.application.access.PermissionResolver;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.exception.BusinessException;
import com.example.learning.entity.User;
import com.example.learning.repository.UserRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 계정 관리 (권한 등급 변경, 프리미엄 부여). MANAGE_ACCOUNTS 권한이 필요하다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

	private final UserRepository userRepository;
	private final PermissionResolver permissionResolver;

	@Transactional(readOnly = true)
	public List<User> listUsers(UserIdentity caller) {
		requireAccountManager(caller);
		return userRepository.findAll(Sort.by(Sort.Direction.ASC, "email"));
	}

	@Transactional
	public User changePermissionLevel(UserIdentity caller, String targetUserId, PermissionLevel level) {
		requireAccountManager(caller);
		User user = userRepository.findById(targetUserId)
			.orElseThrow(() -> BusinessException.notFound("사용자", targetUserId));
		PermissionLevel previous = user.getPermissionLevel();
		user.setPermissionLevel(level);
		log.info("Permission level changed for userId: {} {} -> {} by {}", targetUserId, previous, level, caller.getId());
		return userRepository.save(user);
	}

	@Transactional
	public User setPremium(UserIdentity caller, String targetUserId, boolean premium) {
		requireAccountManager(caller);
		User user = userRepository.findById(targetUserId)
			.orElseThrow(() -> BusinessException.notFound("사용자", targetUserId));
		user.setPremium(premium);
		log.info("Premium flag set to {} for userId: {} by {}", premium, targetUserId, caller.getId());
		return userRepository.save(user);
	}

	private void requireAccountManager(UserIdentity caller) {
		if (!permissionResolver.hasCapability(caller, Capability.MANAGE_ACCOUNTS)) {
			throw BusinessException.forbidden("계정 관리 권한이 필요합니다.");
		}
	}
}
