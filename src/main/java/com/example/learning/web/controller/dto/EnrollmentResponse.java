package com.example.learning.web.controller.dto;

import com.example.learning.entity.Enrollment;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EnrollmentResponse {
	Long id;
	String userId;
	Long courseId;
	int progress;
	boolean completed;
	LocalDateTime enrolledAt;
	LocalDateTime completedAt;

	public static EnrollmentResponse from(Enrollment enrollment) {
		return EnrollmentResponse.builder()
			.id(enrollment.getId())
			.userId(enrollment.getUserId())
			.courseId(enrollment.getCourseId())
			.progress(enrollment.getProgress())
			.completed(enrollment.isCompleted())
			.enrolledAt(enrollment.getEnrolledAt())
			.completedAt(enrollment.getCompletedAt())
			.build();
	}
}
