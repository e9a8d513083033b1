package com.example.learning.application.access;

/**
 * 관리 기능 단위 권한.
 */
public enum Capability {
	MANAGE_BLOG,
	MANAGE_COURSES,
	MODERATE_FORUM,
	MANAGE_ACCOUNTS
}
