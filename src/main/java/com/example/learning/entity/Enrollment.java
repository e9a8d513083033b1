package com.example.learning.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "enrollments", uniqueConstraints = @UniqueConstraint(name = "uk_enrollment_user_course", columnNames = {"userId", "courseId"}))
@Getter
@Setter
public class Enrollment {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(nullable = false, length = 64)
	private String userId;

	@Column(nullable = false)
	private Long courseId;

	// 0 ~ 100
	private int progress;

	// progress == 100 일 때만 true
	private boolean completed;

	// 코스 구조 변경 후 아직 재계산되지 않은 상태
	private boolean progressStale;

	private LocalDateTime enrolledAt;

	private LocalDateTime completedAt;

	@Version
	private Long version;

	/**
	 * 재계산된 진행률을 반영한다. completed 와 completedAt 은 progress 로부터만 파생된다.
	 */
	public void applyProgress(int newProgress, LocalDateTime now) {
		if (newProgress < 0 || newProgress > 100) {
			throw new IllegalStateException("progress out of range: " + newProgress);
		}
		this.progress = newProgress;
		this.completed = newProgress == 100;
		if (completed && completedAt == null) {
			completedAt = now;
		} else if (!completed) {
			completedAt = null;
		}
		this.progressStale = false;
	}

	@PrePersist
	void prePersist() {
		if (enrolledAt == null) enrolledAt = LocalDateTime.now();
	}
}
