package com.example.learning.e2e;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.learning.application.access.PermissionLevel;
import com.example.learning.application.access.UserIdentity;
import com.example.learning.application.service.CourseStructureService;
import com.example.learning.application.service.ProgressService;
import com.example.learning.entity.Course;
import com.example.learning.entity.CourseModule;
import com.example.learning.entity.Enrollment;
import com.example.learning.entity.Lesson;
import com.example.learning.entity.User;
import com.example.learning.repository.CourseModuleRepository;
import com.example.learning.repository.CourseRepository;
import com.example.learning.repository.EnrollmentRepository;
import com.example.learning.repository.LessonCompletionRepository;
import com.example.learning.repository.LessonRepository;
import com.example.learning.repository.PurchaseRepository;
import com.example.learning.repository.UserRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * 같은 수강 정보/같은 모듈에 대한 동시 요청이 직렬화되는지 확인한다.
 */
@SpringBootTest
class ConcurrencyFlowTest {

	private static final int LESSON_COUNT = 6;

	@Autowired
	private ProgressService progressService;

	@Autowired
	private CourseStructureService structureService;

	@Autowired
	private UserRepository userRepository;

	@Autowired
	private CourseRepository courseRepository;

	@Autowired
	private CourseModuleRepository moduleRepository;

	@Autowired
	private LessonRepository lessonRepository;

	@Autowired
	private EnrollmentRepository enrollmentRepository;

	@Autowired
	private PurchaseRepository purchaseRepository;

	@Autowired
	private LessonCompletionRepository completionRepository;

	private Course course;
	private CourseModule module;
	private final List<Lesson> lessons = new ArrayList<>();

	private final UserIdentity author = UserIdentity.of("author", false, false, PermissionLevel.COURSE_ADMIN);

	// 테스트 시작 전 DB를 초기화합니다.
	@BeforeEach
	void setUp() {
		completionRepository.deleteAll();
		enrollmentRepository.deleteAll();
		purchaseRepository.deleteAll();
		lessonRepository.deleteAll();
		moduleRepository.deleteAll();
		courseRepository.deleteAll();
		userRepository.deleteAll();

		User student = new User();
		student.setId("student");
		userRepository.save(student);

		course = new Course();
		course.setTitle("동시성 실습");
		course.setFree(true);
		course.setPublished(true);
		course = courseRepository.save(course);

		module = new CourseModule();
		module.setCourseId(course.getId());
		module.setTitle("락");
		module.setPublished(true);
		module = moduleRepository.save(module);

		lessons.clear();
		for (int i = 0; i < LESSON_COUNT; i++) {
			Lesson lesson = new Lesson();
			lesson.setModuleId(module.getId());
			lesson.setTitle("lesson-" + i);
			lesson.setOrderIndex(i);
			lesson.setPublished(true);
			lessons.add(lessonRepository.save(lesson));
		}
	}

	/**
	 * 수강 등록 없이 서로 다른 레슨 완료 요청이 동시에 들어와도
	 * 수강 정보는 하나만 생기고 최종 진도율은 100 이어야 한다.
	 */
	@Test
	void testConcurrentCompletions_singleEnrollmentAndFullProgress() throws Exception {
		UserIdentity student = UserIdentity.from(userRepository.findById("student").get());
		Queue<Throwable> failures = new ConcurrentLinkedQueue<>();

		runConcurrently(LESSON_COUNT, LESSON_COUNT, i -> progressService.recordCompletion(student, lessons.get(i).getId()), failures);

		assertThat(failures).isEmpty();
		List<Enrollment> enrollments = enrollmentRepository.findAll();
		assertThat(enrollments).hasSize(1);
		assertThat(completionRepository.count()).isEqualTo(LESSON_COUNT);
		assertThat(enrollments.get(0).getProgress()).isEqualTo(100);
		assertThat(enrollments.get(0).isCompleted()).isTrue();
		assertThat(courseRepository.findById(course.getId()).get().getStudentCount()).isEqualTo(1);
	}

	/**
	 * 같은 모듈의 레슨 재정렬이 동시에 실행돼도 순서 번호는 0..n-1 로 빈틈없이 유지된다.
	 */
	@Test
	void testConcurrentLessonReorders_keepIndicesContiguous() throws Exception {
		Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
		int tasks = 4 * LESSON_COUNT;

		runConcurrently(4, tasks, i -> structureService.reorderLesson(author,
			lessons.get(i % LESSON_COUNT).getId(), (i * 3) % LESSON_COUNT), failures);

		assertThat(failures).isEmpty();
		List<Integer> indices = new ArrayList<>();
		for (Lesson lesson : lessonRepository.findByModuleIdOrderByOrderIndexAsc(module.getId())) {
			indices.add(lesson.getOrderIndex());
		}
		List<Integer> expected = new ArrayList<>();
		for (int i = 0; i < LESSON_COUNT; i++) {
			expected.add(i);
		}
		assertThat(indices).isEqualTo(expected);
	}

	private void runConcurrently(int threads, int tasks, IndexedTask task, Queue<Throwable> failures)
		throws InterruptedException {
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		CountDownLatch done = new CountDownLatch(tasks);
		try {
			for (int i = 0; i < tasks; i++) {
				int index = i;
				executor.submit(() -> {
					try {
						start.await();
						task.run(index);
					} catch (Throwable e) {
						failures.add(e);
					} finally {
						done.countDown();
					}
				});
			}
			start.countDown();
			boolean completed = done.await(20, TimeUnit.SECONDS);
			assertThat(completed).isTrue();
		} finally {
			executor.shutdownNow();
		}
	}

	@FunctionalInterface
	private interface IndexedTask {
		void run(int index) throws Exception;
	}
}
