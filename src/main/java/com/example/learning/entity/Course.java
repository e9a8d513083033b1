package com.example.learning.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "courses")
@Getter
@Setter
public class Course {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(nullable = false)
	private String title;

	@Column(length = 4000)
	private String description;

	private String category;

	private String level;

	// free 가 true 이면 price 는 무시된다
	@Column(precision = 10, scale = 2)
	private BigDecimal price;

	private boolean free;

	private boolean published;

	private int studentCount;

	private LocalDateTime createdAt;

	private LocalDateTime updatedAt;

	/**
	 * 유료 여부. free 플래그가 항상 우선한다.
	 */
	public boolean isPaid() {
		return !free;
	}

	@PrePersist
	void prePersist() {
		LocalDateTime now = LocalDateTime.now();
		if (createdAt == null) createdAt = now;
		updatedAt = now;
	}

	@PreUpdate
	void preUpdate() {
		updatedAt = LocalDateTime.now();
	}
}
