package com.example.learning.web.controller.dto;

import com.example.learning.application.access.Capability;
import com.example.learning.application.access.PermissionLevel;
import com.example.learning.entity.User;
import java.util.Set;
import lombok.Value;

@Value
public class UserResponse {
	String id;
	String email;
	String firstName;
	String lastName;
	boolean premium;
	boolean admin;
	PermissionLevel permissionLevel;
	Set<Capability> capabilities;

	public static UserResponse of(User user, Set<Capability> capabilities) {
		return new UserResponse(user.getId(), user.getEmail(), user.getFirstName(), user.getLastName(),
			user.isPremium(), user.isAdmin(), user.getPermissionLevel(), capabilities);
	}
}
