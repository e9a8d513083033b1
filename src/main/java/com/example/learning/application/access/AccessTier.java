package com.example.learning.application.access;

/**
 * 사용자가 특정 코스에 대해 가지는 접근 등급.
 * 선언 순서는 판정 우선순위의 역순이다 (Admin > Enrolled > Purchased > Premium > Free > None).
 */
public enum AccessTier {

	NO_ACCESS,
	FREE_PREVIEW,
	PREMIUM_ACCESS,
	PURCHASED_ACCESS,
	ENROLLED_ACCESS,
	ADMIN_PREVIEW;

	public boolean grantsAccess() {
		return this != NO_ACCESS;
	}

	public boolean includesDrafts() {
		return this == ADMIN_PREVIEW;
	}
}
