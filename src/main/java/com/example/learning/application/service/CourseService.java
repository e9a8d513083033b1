package com.example.learning.application.service;

import com.example.learning.application.access.AccessTier;
import com.example.learning.application.access.Capability;
import com.example.learning.application.access.EntitlementResolver;
import com.example.learning.application.access.PermissionResolver;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.content.ContentVisibilityFilter;
import com.example.learning.application.content.CourseTreeLoader;
import com.example.learning.application.content.FilteredTree;
import com.example.learning.application.exception.BusinessException;
import com.example.learning.entity.Course;
import com.example.learning.repository.CourseRepository;
import com.example.learning.web.controller.dto.CourseRequest;
import com.example.learning.web.controller.dto.CourseUpdateRequest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class CourseService {

	private final CourseRepository courseRepository;
	private final PermissionResolver permissionResolver;
	private final EntitlementResolver entitlementResolver;
	private final CourseTreeLoader courseTreeLoader;
	private final ContentVisibilityFilter visibilityFilter;

	@Transactional(readOnly = true)
	public List<Course> listCourses(UserIdentity caller, boolean includeDrafts) {
		if (!includeDrafts) {
			return courseRepository.findByPublishedTrueOrderByCreatedAtDesc();
		}
		requireCourseManager(caller);
		return courseRepository.findAllByOrderByCreatedAtDesc();
	}

	@Transactional(readOnly = true)
	public List<Course> listFreeCourses() {
		return courseRepository.findByPublishedTrueAndFreeTrueOrderByCreatedAtDesc();
	}

	/**
	 * 공개된 유료 코스. 구매 또는 프리미엄 구독이 있어야 수강할 수 있다.
	 */
	@Transactional(readOnly = true)
	public List<Course> listPremiumCourses() {
		return courseRepository.findByPublishedTrueAndFreeFalseOrderByCreatedAtDesc();
	}

	@Transactional(readOnly = true)
	public Course getCourse(Long courseId) {
		return courseRepository.findById(courseId)
			.orElseThrow(() -> BusinessException.notFound("코스", courseId));
	}

	@Transactional(readOnly = true)
	public AccessTier resolveAccess(UserIdentity caller, Long courseId) {
		return entitlementResolver.resolveEntitlement(caller, getCourse(courseId));
	}

	/**
	 * 요청자의 접근 등급에 맞게 걸러진 코스 구조.
	 */
	@Transactional(readOnly = true)
	public FilteredTree getCourseTree(UserIdentity caller, Long courseId) {
		Course course = getCourse(courseId);
		AccessTier tier = entitlementResolver.resolveEntitlement(caller, course);
		return visibilityFilter.filterTree(courseTreeLoader.load(course), tier);
	}

	@Transactional
	public Course createCourse(UserIdentity caller, CourseRequest request) {
		requireCourseManager(caller);
		Course course = new Course();
		course.setTitle(request.getTitle());
		course.setDescription(request.getDescription());
		course.setCategory(request.getCategory());
		course.setLevel(request.getLevel());
		course.setPrice(request.getPrice());
		course.setFree(request.isFree());
		course.setPublished(request.isPublished());
		Course saved = courseRepository.save(course);
		log.info("Course created: courseId: {}, free: {}, by {}", saved.getId(), saved.isFree(), caller.getId());
		return saved;
	}

	@Transactional
	public Course updateCourse(UserIdentity caller, Long courseId, CourseUpdateRequest request) {
		requireCourseManager(caller);
		Course course = courseRepository.findByIdForUpdate(courseId)
			.orElseThrow(() -> BusinessException.notFound("코스", courseId));
		if (request.getTitle() != null) course.setTitle(request.getTitle());
		if (request.getDescription() != null) course.setDescription(request.getDescription());
		if (request.getCategory() != null) course.setCategory(request.getCategory());
		if (request.getLevel() != null) course.setLevel(request.getLevel());
		if (request.getPrice() != null) course.setPrice(request.getPrice());
		if (request.getFree() != null) course.setFree(request.getFree());
		if (request.getPublished() != null) course.setPublished(request.getPublished());
		Course saved = courseRepository.save(course);
		log.info("Course updated: courseId: {}, by {}", courseId, caller.getId());
		return saved;
	}

	private void requireCourseManager(UserIdentity caller) {
		if (!permissionResolver.hasCapability(caller, Capability.MANAGE_COURSES)) {
			throw BusinessException.forbidden("코스 관리 권한이 필요합니다.");
		}
	}
}
