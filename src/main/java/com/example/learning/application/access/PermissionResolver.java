package com.example.learning.application.access;

import java.util.EnumSet;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * 사용자 레코드를 관리 권한 집합으로 변환한다.
 *
 * 권한 등급(permissionLevel)과 레거시 admin 플래그는 서로를 덮어쓰지 않는다.
 * 레거시 admin 플래그는 MANAGE_COURSES 를 부여하고, 최종 권한은 두 출처의 합집합이다.
 */
@Component
public class PermissionResolver {

	public CapabilitySet resolvePermissions(UserIdentity user) {
		if (user.isAnonymous()) {
			return CapabilitySet.empty();
		}
		Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
		capabilities.addAll(user.getPermissionLevel().capabilities());
		if (user.isAdmin()) {
			capabilities.add(Capability.MANAGE_COURSES);
		}
		return CapabilitySet.of(capabilities);
	}

	public boolean hasCapability(UserIdentity user, Capability capability) {
		return resolvePermissions(user).has(capability);
	}
}
