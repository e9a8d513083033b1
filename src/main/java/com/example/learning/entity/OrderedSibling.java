package com.example.learning.entity;

/**
 * 같은 부모 아래에서 0부터 연속된 orderIndex 를 갖는 구조 요소.
 */
public interface OrderedSibling {

	Long getId();

	int getOrderIndex();

	void setOrderIndex(int orderIndex);
}
