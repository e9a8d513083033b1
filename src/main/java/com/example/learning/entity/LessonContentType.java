package com.example.learning.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * API 에서는 소문자(text, video, quiz)로 주고받는다. DB 에는 상수 이름 그대로 저장된다.
 */
public enum LessonContentType {
	@JsonProperty("text")
	TEXT,
	@JsonProperty("video")
	VIDEO,
	@JsonProperty("quiz")
	QUIZ
}
