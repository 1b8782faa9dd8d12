package dev.wirecall.greeter.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import dev.wirecall.greeter.config.GreeterProperties;

/**
 * Service layer implementing the greeter operations. Invalid input is reported with runtime
 * exceptions that the endpoint translates into application errors.
 */
@Service
public class GreetingService {

	private static final Logger logger = LoggerFactory.getLogger(GreetingService.class);

	private final int maxSubjectLength;

	/**
	 * Create a new service limited by the supplied {@link GreeterProperties}.
	 * @param properties configuration supplying the subject length limit
	 */
	public GreetingService(GreeterProperties properties) {
		this.maxSubjectLength = properties.getMaxSubjectLength();
		logger.info("Greeting service accepts subjects up to {} characters", this.maxSubjectLength);
	}

	/**
	 * Describe a subject with a value.
	 * @param subject what is being described
	 * @param value value attributed to the subject
	 * @return {@code "<subject> is <value>"}
	 * @throws IllegalArgumentException when the subject is blank or too long
	 */
	public String describe(String subject, int value) {
		if (!StringUtils.hasText(subject)) {
			throw new IllegalArgumentException("subject must not be blank");
		}
		if (subject.length() > this.maxSubjectLength) {
			throw new IllegalArgumentException(
					"subject exceeds " + this.maxSubjectLength + " characters: " + subject.length());
		}
		return subject + " is " + value;
	}

	/**
	 * Add two numbers.
	 * @param a first operand
	 * @param b second operand
	 * @return the exact sum
	 * @throws ArithmeticException when the sum overflows a {@code long}
	 */
	public long add(long a, long b) {
		return Math.addExact(a, b);
	}

}
