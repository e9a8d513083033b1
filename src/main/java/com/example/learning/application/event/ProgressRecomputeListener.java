package com.example.learning.application.event;

import com.example.learning.application.service.ProgressReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "learning.progress.eager-recompute", havingValue = "true", matchIfMissing = true)
public class ProgressRecomputeListener {

	private final ProgressReconciliationService reconciliationService;

	// 구조 변경 트랜잭션이 커밋된 뒤에만 재계산한다
	@Async
	@TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
	public void onCourseStructureChanged(CourseStructureChangedEvent event) {
		log.debug("Recomputing progress for courseId: {} ({})", event.getCourseId(), event.getReason());
		reconciliationService.recomputeCourse(event.getCourseId());
	}
}
