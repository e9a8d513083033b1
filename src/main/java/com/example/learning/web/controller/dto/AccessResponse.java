package com.example.learning.web.controller.dto;

import com.example.learning.application.access.AccessTier;
import lombok.Value;

@Value
public class AccessResponse {
	Long courseId;
	AccessTier accessTier;
	boolean hasAccess;
}
