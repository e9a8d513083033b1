package com.example.learning.web.controller.dto;

import com.example.learning.entity.Lesson;
import com.example.learning.entity.LessonContentType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LessonResponse {
	Long id;
	Long moduleId;
	String title;
	String description;
	LessonContentType contentType;
	int orderIndex;
	boolean published;
	String videoUrl;
	Integer duration;

	public static LessonResponse from(Lesson lesson) {
		return LessonResponse.builder()
			.id(lesson.getId())
			.moduleId(lesson.getModuleId())
			.title(lesson.getTitle())
			.description(lesson.getDescription())
			.contentType(lesson.getContentType())
			.orderIndex(lesson.getOrderIndex())
			.published(lesson.isPublished())
			.videoUrl(lesson.getVideoUrl())
			.duration(lesson.getDuration())
			.build();
	}
}
