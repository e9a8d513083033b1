package com.example.learning.web.controller;

/**
 * 인증은 앞단 게이트웨이가 처리한다고 가정하고, 확인된 사용자 id 만 헤더로 전달받는다.
 * 헤더가 없으면 익명 사용자로 취급한다.
 */
public final class CallerHeaders {

	public static final String USER_ID = "X-User-Id";

	private CallerHeaders() {
	}
}
