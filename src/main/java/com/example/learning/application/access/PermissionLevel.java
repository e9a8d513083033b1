package com.example.learning.application.access;

import java.util.EnumSet;
import java.util.Set;

/**
 * 사용자 권한 등급. 등급마다 고정된 {@link Capability} 부분집합을 가진다.
 */
public enum PermissionLevel {

	MEMBER(EnumSet.noneOf(Capability.class)),

	BLOG_ADMIN(EnumSet.of(Capability.MANAGE_BLOG)),

	COURSE_ADMIN(EnumSet.of(Capability.MANAGE_COURSES)),

	FORUM_MODERATOR(EnumSet.of(Capability.MODERATE_FORUM)),

	SUPER_ADMIN(EnumSet.allOf(Capability.class));

	private final EnumSet<Capability> capabilities;

	PermissionLevel(EnumSet<Capability> capabilities) {
		this.capabilities = capabilities;
	}

	public Set<Capability> capabilities() {
		return EnumSet.copyOf(capabilities);
	}
}
