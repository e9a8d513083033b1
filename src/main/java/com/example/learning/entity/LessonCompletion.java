package com.example.learning.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "lesson_completions", uniqueConstraints = @UniqueConstraint(name = "uk_completion_user_lesson", columnNames = {"userId", "lessonId"}))
@Getter
@Setter
public class LessonCompletion {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(nullable = false, length = 64)
	private String userId;

	@Column(nullable = false)
	private Long lessonId;

	private LocalDateTime completedAt;

	@PrePersist
	void prePersist() {
		if (completedAt == null) completedAt = LocalDateTime.now();
	}
}
