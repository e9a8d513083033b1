package com.example.learning.entity;

import com.example.learning.application.access.PermissionLevel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "users")
@Getter
@Setter
public class User {

	// 외부 인증 제공자가 발급한 식별자
	@Id
	@Column(length = 64)
	private String id;

	private String email;

	private String firstName;

	private String lastName;

	private boolean premium;

	// 레거시 관리자 플래그 (MANAGE_COURSES 로 매핑)
	private boolean admin;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 32)
	private PermissionLevel permissionLevel = PermissionLevel.MEMBER;

	private LocalDateTime createdAt;

	private LocalDateTime updatedAt;

	@PrePersist
	void prePersist() {
		LocalDateTime now = LocalDateTime.now();
		if (createdAt == null) createdAt = now;
		updatedAt = now;
		if (permissionLevel == null) permissionLevel = PermissionLevel.MEMBER;
	}

	@PreUpdate
	void preUpdate() {
		updatedAt = LocalDateTime.now();
	}
}
