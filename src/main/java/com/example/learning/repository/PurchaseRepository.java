package com.example.learning.repository;

import com.example.learning.entity.Purchase;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PurchaseRepository extends JpaRepository<Purchase, Long> {

	boolean existsByUserIdAndCourseId(String userId, Long courseId);

	Optional<Purchase> findByUserIdAndCourseId(String userId, Long courseId);

	List<Purchase> findByUserIdOrderByPurchasedAtDesc(String userId);
}
