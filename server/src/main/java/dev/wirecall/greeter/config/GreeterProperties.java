package dev.wirecall.greeter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration options for the greeter service.
 */
@ConfigurationProperties(prefix = "wirecall.greeter")
public class GreeterProperties {

	/**
	 * Longest subject accepted by {@code describe}, in characters.
	 */
	private int maxSubjectLength = 256;

	/**
	 * Retrieve the longest accepted subject.
	 * @return maximum subject length in characters
	 */
	public int getMaxSubjectLength() {
		return maxSubjectLength;
	}

	/**
	 * Set the longest accepted subject.
	 * @param maxSubjectLength maximum subject length in characters
	 */
	public void setMaxSubjectLength(int maxSubjectLength) {
		this.maxSubjectLength = maxSubjectLength;
	}

}
