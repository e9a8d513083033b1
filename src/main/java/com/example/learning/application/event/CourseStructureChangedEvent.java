package com.example.learning.application.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 코스 구조(모듈/레슨의 게시 상태, 순서, 존재 여부)가 바뀌었음을 알린다.
 * 해당 코스 수강생들의 진도율 분모가 달라졌을 수 있다.
 */
@Getter
public class CourseStructureChangedEvent extends ApplicationEvent {
	private final Long courseId;
	private final String reason;

	public CourseStructureChangedEvent(Object source, Long courseId, String reason) {
		super(source);
		this.courseId = courseId;
		this.reason = reason;
	}
}
