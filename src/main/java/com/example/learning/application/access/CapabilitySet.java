package com.example.learning.application.access;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode
@ToString
public final class CapabilitySet {

	private static final CapabilitySet EMPTY = new CapabilitySet(EnumSet.noneOf(Capability.class));

	private final Set<Capability> capabilities;

	private CapabilitySet(EnumSet<Capability> capabilities) {
		this.capabilities = Collections.unmodifiableSet(capabilities);
	}

	public static CapabilitySet empty() {
		return EMPTY;
	}

	public static CapabilitySet of(Collection<Capability> capabilities) {
		if (capabilities.isEmpty()) {
			return EMPTY;
		}
		return new CapabilitySet(EnumSet.copyOf(capabilities));
	}

	public boolean has(Capability capability) {
		return capabilities.contains(capability);
	}

	public boolean isEmpty() {
		return capabilities.isEmpty();
	}

	public Set<Capability> asSet() {
		return capabilities;
	}
}
