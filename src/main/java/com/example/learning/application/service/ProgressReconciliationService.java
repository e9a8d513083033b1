package com.example.learning.application.service;

import com.example.learning.repository.EnrollmentRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * 구조 변경 뒤 재계산되지 않고 남은 수강 진도율을 보정한다.
 * 수강 행 하나의 실패는 기록만 하고 나머지 보정을 계속한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressReconciliationService implements CommandLineRunner {

	private final EnrollmentRepository enrollmentRepository;
	private final ProgressService progressService;

	/**
	 * 스케줄러: 주기적으로 stale 상태인 수강 정보를 재계산한다.
	 */
	@Scheduled(
		fixedDelayString = "${learning.progress.reconcile-interval-ms:300000}",
		initialDelayString = "${learning.progress.reconcile-initial-delay-ms:60000}"
	)
	public void reconcileStaleEnrollments() {
		List<Long> staleIds = enrollmentRepository.findStaleIds();
		if (staleIds.isEmpty()) {
			return;
		}
		int recomputed = recomputeAll(staleIds);
		log.info("Progress reconciliation finished: {}/{} stale enrollments recomputed", recomputed, staleIds.size());
	}

	/**
	 * 코스 하나의 모든 수강 진도율을 재계산한다.
	 */
	public void recomputeCourse(Long courseId) {
		List<Long> enrollmentIds = enrollmentRepository.findIdsByCourseId(courseId);
		int recomputed = recomputeAll(enrollmentIds);
		log.info("Progress recomputed for courseId: {} ({}/{} enrollments)", courseId, recomputed, enrollmentIds.size());
	}

	private int recomputeAll(List<Long> enrollmentIds) {
		int recomputed = 0;
		for (Long enrollmentId : enrollmentIds) {
			try {
				progressService.recomputeEnrollment(enrollmentId);
				recomputed++;
			} catch (Exception e) {
				log.error("Error recomputing progress for enrollment id: {}. {}", enrollmentId, e.getMessage(), e);
			}
		}
		return recomputed;
	}

	/**
	 * 시스템 시작 시 남아 있는 stale 수강 정보가 있으면 즉시 보정
	 */
	@Override
	public void run(String... args) {
		reconcileStaleEnrollments();
	}
}
