package com.example.learning.application.access;

import com.example.learning.entity.User;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 요청자 식별 정보. 모든 판정 로직은 이 값을 명시적인 인자로 받는다.
 * 인증되지 않은 요청자는 {@link #ANONYMOUS} 로 표현한다.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UserIdentity {

	public static final UserIdentity ANONYMOUS = new UserIdentity(null, false, false, PermissionLevel.MEMBER);

	String id;

	boolean premium;

	// 레거시 관리자 플래그
	boolean admin;

	PermissionLevel permissionLevel;

	public static UserIdentity from(User user) {
		PermissionLevel level = user.getPermissionLevel() != null ? user.getPermissionLevel() : PermissionLevel.MEMBER;
		return new UserIdentity(user.getId(), user.isPremium(), user.isAdmin(), level);
	}

	public static UserIdentity of(String id, boolean premium, boolean admin, PermissionLevel permissionLevel) {
		return new UserIdentity(id, premium, admin, permissionLevel != null ? permissionLevel : PermissionLevel.MEMBER);
	}

	public boolean isAnonymous() {
		return id == null;
	}
}
