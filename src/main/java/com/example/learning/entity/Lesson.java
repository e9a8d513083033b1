package com.example.learning.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "course_lessons", indexes = @Index(name = "idx_lesson_module", columnList = "moduleId,orderIndex"))
@Getter
@Setter
public class Lesson implements OrderedSibling {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(nullable = false)
	private Long moduleId;

	@Column(nullable = false)
	private String title;

	@Column(length = 4000)
	private String description;

	@Column(length = 20000)
	private String content;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 16)
	private LessonContentType contentType = LessonContentType.TEXT;

	private int orderIndex;

	private boolean published;

	private String videoUrl;

	// 분 단위
	private Integer duration;

	private LocalDateTime createdAt;

	private LocalDateTime updatedAt;

	@PrePersist
	void prePersist() {
		LocalDateTime now = LocalDateTime.now();
		if (createdAt == null) createdAt = now;
		updatedAt = now;
		if (contentType == null) contentType = LessonContentType.TEXT;
	}

	@PreUpdate
	void preUpdate() {
		updatedAt = LocalDateTime.now();
	}
}
