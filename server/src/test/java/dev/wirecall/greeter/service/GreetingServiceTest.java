package dev.wirecall.greeter.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import dev.wirecall.greeter.config.GreeterProperties;

class GreetingServiceTest {

	private final GreetingService service = new GreetingService(limitedTo(5));

	@Test
	void describesSubject() {
		assertEquals("sky is 3", service.describe("sky", 3));
	}

	@Test
	void rejectsBlankAndLongSubjects() {
		assertThrows(IllegalArgumentException.class, () -> service.describe(" ", 1));
		assertThrows(IllegalArgumentException.class, () -> service.describe("sixsix", 1));
	}

	@Test
	void addDetectsOverflow() {
		assertEquals(5L, service.add(2, 3));
		assertThrows(ArithmeticException.class, () -> service.add(Long.MAX_VALUE, 1));
	}

	private static GreeterProperties limitedTo(int length) {
		GreeterProperties properties = new GreeterProperties();
		properties.setMaxSubjectLength(length);
		return properties;
	}

}
