package com.example.learning.application.content;

import com.example.learning.application.access.AccessTier;
import com.example.learning.entity.LessonContentType;
import java.util.List;
import lombok.Value;

/**
 * 요청자에게 노출 가능한 코스 구조.
 * ADMIN_PREVIEW 에서는 미게시 콘텐츠도 포함되며 draft 플래그로 구분된다.
 */
@Value
public class FilteredTree {

	Long courseId;

	String title;

	String description;

	AccessTier accessTier;

	List<ModuleEntry> modules;

	@Value
	public static class ModuleEntry {
		Long id;
		String title;
		String description;
		int orderIndex;
		boolean published;
		boolean draft;
		List<LessonEntry> lessons;
	}

	@Value
	public static class LessonEntry {
		Long id;
		String title;
		LessonContentType contentType;
		int orderIndex;
		Integer duration;
		boolean published;
		// 레슨 자체 또는 상위 모듈이 미게시
		boolean draft;
	}
}
