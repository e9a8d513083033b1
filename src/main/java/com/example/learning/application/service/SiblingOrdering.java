package com.example.learning.application.service;

import com.example.learning.application.exception.BusinessException;
import com.example.learning.application.exception.ErrorCode;
import com.example.learning.entity.OrderedSibling;
import java.util.List;

/**
 * 형제 요소의 orderIndex 를 0부터 연속되도록 유지한다.
 * 호출자는 형제 목록 전체를 orderIndex 순으로 넘기고, 변경된 전체 범위를 같은 트랜잭션에서 저장한다.
 */
final class SiblingOrdering {

	private SiblingOrdering() {
	}

	static int nextIndex(List<? extends OrderedSibling> siblings) {
		if (siblings.isEmpty()) {
			return 0;
		}
		return siblings.get(siblings.size() - 1).getOrderIndex() + 1;
	}

	static <T extends OrderedSibling> T find(List<T> siblings, Long id) {
		return siblings.stream()
			.filter(sibling -> sibling.getId().equals(id))
			.findFirst()
			.orElse(null);
	}

	/**
	 * target 을 newIndex 위치로 옮기고 사이의 형제들을 한 칸씩 민다.
	 */
	static <T extends OrderedSibling> void move(List<T> siblings, T target, int newIndex) {
		if (newIndex < 0 || newIndex >= siblings.size()) {
			throw new BusinessException(ErrorCode.INVALID_ORDER,
				"이동할 위치가 범위를 벗어났습니다. newIndex=" + newIndex + ", size=" + siblings.size());
		}
		siblings.remove(target);
		siblings.add(newIndex, target);
		renumber(siblings);
	}

	static void renumber(List<? extends OrderedSibling> siblings) {
		for (int i = 0; i < siblings.size(); i++) {
			siblings.get(i).setOrderIndex(i);
		}
	}
}
