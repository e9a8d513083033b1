package com.example.learning.application.service;

import com.example.learning.application.access.Capability;
import com.example.learning.application.access.PermissionResolver;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.event.CourseStructureChangedEvent;
import com.example.learning.application.exception.BusinessException;
import com.example.learning.entity.CourseModule;
import com.example.learning.entity.Lesson;
import com.example.learning.repository.CourseModuleRepository;
import com.example.learning.repository.CourseRepository;
import com.example.learning.repository.EnrollmentRepository;
import com.example.learning.repository.LessonCompletionRepository;
import com.example.learning.repository.LessonRepository;
import com.example.learning.web.controller.dto.LessonRequest;
import com.example.learning.web.controller.dto.LessonUpdateRequest;
import com.example.learning.web.controller.dto.ModuleRequest;
import com.example.learning.web.controller.dto.ModuleUpdateRequest;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 코스 구조 관리 (모듈/레슨 생성, 수정, 재정렬, 삭제). MANAGE_COURSES 권한이 필요하다.
 *
 * 같은 형제 집합에 대한 변경은 부모 행(모듈은 코스, 레슨은 모듈)을 PESSIMISTIC_WRITE 로 잠가 직렬화한다.
 * 잠금 후 형제 전체를 다시 읽고, 번호를 다시 매긴 전체 범위를 같은 트랜잭션에서 저장한다.
 * 모든 변경은 해당 코스 수강 진도율을 무효화하고 {@link CourseStructureChangedEvent} 를 발행한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CourseStructureService {

	private final CourseRepository courseRepository;
	private final CourseModuleRepository moduleRepository;
	private final LessonRepository lessonRepository;
	private final LessonCompletionRepository completionRepository;
	private final EnrollmentRepository enrollmentRepository;
	private final PermissionResolver permissionResolver;
	private final ApplicationEventPublisher eventPublisher;

	// =========================
	// 모듈
	// =========================

	@Transactional
	public CourseModule createModule(UserIdentity caller, Long courseId, ModuleRequest request) {
		requireCourseManager(caller);
		lockCourse(courseId);
		List<CourseModule> siblings = moduleRepository.findByCourseIdOrderByOrderIndexAsc(courseId);

		CourseModule module = new CourseModule();
		module.setCourseId(courseId);
		module.setTitle(request.getTitle());
		module.setDescription(request.getDescription());
		module.setPublished(request.isPublished());
		module.setOrderIndex(SiblingOrdering.nextIndex(siblings));
		CourseModule saved = moduleRepository.save(module);

		structureChanged(courseId, "module created");
		log.info("Module created: moduleId: {}, courseId: {}, orderIndex: {}", saved.getId(), courseId, saved.getOrderIndex());
		return saved;
	}

	@Transactional
	public CourseModule updateModule(UserIdentity caller, Long moduleId, ModuleUpdateRequest request) {
		requireCourseManager(caller);
		Long courseId = courseIdOf(moduleId);
		lockCourse(courseId);
		CourseModule module = moduleRepository.findById(moduleId)
			.orElseThrow(() -> BusinessException.notFound("모듈", moduleId));

		if (request.getTitle() != null) module.setTitle(request.getTitle());
		if (request.getDescription() != null) module.setDescription(request.getDescription());
		if (request.getPublished() != null) module.setPublished(request.getPublished());
		CourseModule saved = moduleRepository.save(module);

		structureChanged(courseId, "module updated");
		log.info("Module updated: moduleId: {}, published: {}", moduleId, saved.isPublished());
		return saved;
	}

	@Transactional
	public List<CourseModule> reorderModule(UserIdentity caller, Long moduleId, int newIndex) {
		requireCourseManager(caller);
		Long courseId = courseIdOf(moduleId);
		lockCourse(courseId);
		List<CourseModule> siblings = new ArrayList<>(moduleRepository.findByCourseIdOrderByOrderIndexAsc(courseId));
		CourseModule target = SiblingOrdering.find(siblings, moduleId);
		if (target == null) {
			throw BusinessException.notFound("모듈", moduleId);
		}

		SiblingOrdering.move(siblings, target, newIndex);
		moduleRepository.saveAll(siblings);

		structureChanged(courseId, "module reordered");
		log.info("Module reordered: moduleId: {}, newIndex: {}", moduleId, newIndex);
		return siblings;
	}

	/**
	 * 모듈과 그 하위 레슨, 레슨 완료 기록을 함께 삭제하고 남은 모듈 번호를 다시 매긴다.
	 */
	@Transactional
	public void deleteModule(UserIdentity caller, Long moduleId) {
		requireCourseManager(caller);
		Long courseId = courseIdOf(moduleId);
		lockCourse(courseId);
		// 하위 레슨 변경(createLesson 등)과 직렬화
		lockModule(moduleId);
		List<CourseModule> siblings = new ArrayList<>(moduleRepository.findByCourseIdOrderByOrderIndexAsc(courseId));
		CourseModule target = SiblingOrdering.find(siblings, moduleId);
		if (target == null) {
			throw BusinessException.notFound("모듈", moduleId);
		}

		List<Long> lessonIds = lessonRepository.findIdsByModuleId(moduleId);
		if (!lessonIds.isEmpty()) {
			completionRepository.deleteByLessonIdIn(lessonIds);
			lessonRepository.deleteByModuleId(moduleId);
		}
		moduleRepository.delete(target);
		siblings.remove(target);
		SiblingOrdering.renumber(siblings);
		moduleRepository.saveAll(siblings);

		structureChanged(courseId, "module deleted");
		log.info("Module deleted: moduleId: {}, courseId: {}, lessons removed: {}", moduleId, courseId, lessonIds.size());
	}

	// =========================
	// 레슨
	// =========================

	@Transactional
	public Lesson createLesson(UserIdentity caller, Long moduleId, LessonRequest request) {
		requireCourseManager(caller);
		CourseModule module = lockModule(moduleId);
		List<Lesson> siblings = lessonRepository.findByModuleIdOrderByOrderIndexAsc(moduleId);

		Lesson lesson = new Lesson();
		lesson.setModuleId(moduleId);
		lesson.setTitle(request.getTitle());
		lesson.setDescription(request.getDescription());
		lesson.setContent(request.getContent());
		lesson.setContentType(request.getContentType());
		lesson.setVideoUrl(request.getVideoUrl());
		lesson.setDuration(request.getDuration());
		lesson.setPublished(request.isPublished());
		lesson.setOrderIndex(SiblingOrdering.nextIndex(siblings));
		Lesson saved = lessonRepository.save(lesson);

		structureChanged(module.getCourseId(), "lesson created");
		log.info("Lesson created: lessonId: {}, moduleId: {}, orderIndex: {}", saved.getId(), moduleId, saved.getOrderIndex());
		return saved;
	}

	@Transactional
	public Lesson updateLesson(UserIdentity caller, Long lessonId, LessonUpdateRequest request) {
		requireCourseManager(caller);
		CourseModule module = lockModule(moduleIdOf(lessonId));
		Lesson lesson = lessonRepository.findById(lessonId)
			.orElseThrow(() -> BusinessException.notFound("레슨", lessonId));

		if (request.getTitle() != null) lesson.setTitle(request.getTitle());
		if (request.getDescription() != null) lesson.setDescription(request.getDescription());
		if (request.getContent() != null) lesson.setContent(request.getContent());
		if (request.getContentType() != null) lesson.setContentType(request.getContentType());
		if (request.getVideoUrl() != null) lesson.setVideoUrl(request.getVideoUrl());
		if (request.getDuration() != null) lesson.setDuration(request.getDuration());
		if (request.getPublished() != null) lesson.setPublished(request.getPublished());
		Lesson saved = lessonRepository.save(lesson);

		structureChanged(module.getCourseId(), "lesson updated");
		log.info("Lesson updated: lessonId: {}, published: {}", lessonId, saved.isPublished());
		return saved;
	}

	@Transactional
	public List<Lesson> reorderLesson(UserIdentity caller, Long lessonId, int newIndex) {
		requireCourseManager(caller);
		CourseModule module = lockModule(moduleIdOf(lessonId));
		List<Lesson> siblings = new ArrayList<>(lessonRepository.findByModuleIdOrderByOrderIndexAsc(module.getId()));
		Lesson target = SiblingOrdering.find(siblings, lessonId);
		if (target == null) {
			throw BusinessException.notFound("레슨", lessonId);
		}

		SiblingOrdering.move(siblings, target, newIndex);
		lessonRepository.saveAll(siblings);

		structureChanged(module.getCourseId(), "lesson reordered");
		log.info("Lesson reordered: lessonId: {}, newIndex: {}", lessonId, newIndex);
		return siblings;
	}

	@Transactional
	public void deleteLesson(UserIdentity caller, Long lessonId) {
		requireCourseManager(caller);
		CourseModule module = lockModule(moduleIdOf(lessonId));
		List<Lesson> siblings = new ArrayList<>(lessonRepository.findByModuleIdOrderByOrderIndexAsc(module.getId()));
		Lesson target = SiblingOrdering.find(siblings, lessonId);
		if (target == null) {
			throw BusinessException.notFound("레슨", lessonId);
		}

		completionRepository.deleteByLessonIdIn(List.of(lessonId));
		lessonRepository.delete(target);
		siblings.remove(target);
		SiblingOrdering.renumber(siblings);
		lessonRepository.saveAll(siblings);

		structureChanged(module.getCourseId(), "lesson deleted");
		log.info("Lesson deleted: lessonId: {}, moduleId: {}", lessonId, module.getId());
	}

	private void requireCourseManager(UserIdentity caller) {
		if (!permissionResolver.hasCapability(caller, Capability.MANAGE_COURSES)) {
			throw BusinessException.forbidden("코스 관리 권한이 필요합니다.");
		}
	}

	private Long courseIdOf(Long moduleId) {
		return moduleRepository.findCourseIdById(moduleId)
			.orElseThrow(() -> BusinessException.notFound("모듈", moduleId));
	}

	private Long moduleIdOf(Long lessonId) {
		return lessonRepository.findModuleIdById(lessonId)
			.orElseThrow(() -> BusinessException.notFound("레슨", lessonId));
	}

	private void lockCourse(Long courseId) {
		courseRepository.findByIdForUpdate(courseId)
			.orElseThrow(() -> BusinessException.notFound("코스", courseId));
	}

	private CourseModule lockModule(Long moduleId) {
		return moduleRepository.findByIdForUpdate(moduleId)
			.orElseThrow(() -> BusinessException.notFound("모듈", moduleId));
	}

	private void structureChanged(Long courseId, String reason) {
		enrollmentRepository.markProgressStale(courseId);
		eventPublisher.publishEvent(new CourseStructureChangedEvent(this, courseId, reason));
	}
}
