package com.example.learning.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "purchases", uniqueConstraints = @UniqueConstraint(name = "uk_purchase_user_course", columnNames = {"userId", "courseId"}))
@Getter
@Setter
public class Purchase {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(nullable = false, length = 64)
	private String userId;

	@Column(nullable = false)
	private Long courseId;

	// 결제 금액
	@Column(nullable = false, precision = 10, scale = 2)
	private BigDecimal amount;

	private LocalDateTime purchasedAt;

	@PrePersist
	void prePersist() {
		if (purchasedAt == null) purchasedAt = LocalDateTime.now();
	}
}
