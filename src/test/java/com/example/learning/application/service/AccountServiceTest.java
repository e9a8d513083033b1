package com.example.learning.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.learning.application.access.PermissionLevel;
import com.example.learning.application.access.PermissionResolver;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.exception.BusinessException;
import com.example.learning.application.exception.ErrorCode;
import com.example.learning.entity.User;
import com.example.learning.repository.UserRepository;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

	@Mock
	private UserRepository userRepository;

	private AccountService accountService;

	private User target;

	private final UserIdentity superAdmin = UserIdentity.of("root", false, false, PermissionLevel.SUPER_ADMIN);

	@BeforeEach
	void setUp() {
		accountService = new AccountService(userRepository, new PermissionResolver());
		target = new User();
		target.setId("u1");
	}

	@Test
	void testChangePermissionLevel_success() {
		when(userRepository.findById("u1")).thenReturn(Optional.of(target));
		when(userRepository.save(target)).thenReturn(target);

		User updated = accountService.changePermissionLevel(superAdmin, "u1", PermissionLevel.COURSE_ADMIN);

		assertEquals(PermissionLevel.COURSE_ADMIN, updated.getPermissionLevel());
	}

	@Test
	void testSetPremium_success() {
		when(userRepository.findById("u1")).thenReturn(Optional.of(target));
		when(userRepository.save(target)).thenReturn(target);

		assertTrue(accountService.setPremium(superAdmin, "u1", true).isPremium());
	}

	// 레거시 관리자 플래그만으로는 계정 관리 불가
	@Test
	void testChangePermissionLevel_failure_legacyAdminForbidden() {
		UserIdentity legacyAdmin = UserIdentity.of("a1", false, true, PermissionLevel.MEMBER);

		BusinessException exception = assertThrows(BusinessException.class,
			() -> accountService.changePermissionLevel(legacyAdmin, "u1", PermissionLevel.SUPER_ADMIN));

		assertEquals(ErrorCode.FORBIDDEN, exception.getErrorCode());
		verify(userRepository, never()).save(any());
	}

	@Test
	void testListUsers_success() {
		User other = new User();
		other.setId("u2");
		when(userRepository.findAll(any(Sort.class))).thenReturn(List.of(target, other));

		List<User> users = accountService.listUsers(superAdmin);

		assertEquals(2, users.size());
	}

	// 코스 관리자도 계정 목록은 볼 수 없다
	@Test
	void testListUsers_failure_forbiddenWithoutManageAccounts() {
		UserIdentity courseAdmin = UserIdentity.of("c1", false, false, PermissionLevel.COURSE_ADMIN);

		BusinessException exception = assertThrows(BusinessException.class,
			() -> accountService.listUsers(courseAdmin));

		assertEquals(ErrorCode.FORBIDDEN, exception.getErrorCode());
		verify(userRepository, never()).findAll(any(Sort.class));
	}

	@Test
	void testSetPremium_failure_unknownUser() {
		when(userRepository.findById("ghost")).thenReturn(Optional.empty());

		BusinessException exception = assertThrows(BusinessException.class,
			() -> accountService.setPremium(superAdmin, "ghost", true));

		assertEquals(ErrorCode.NOT_FOUND, exception.getErrorCode());
	}
}
