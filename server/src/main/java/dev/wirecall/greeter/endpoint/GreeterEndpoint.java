package dev.wirecall.greeter.endpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.wirecall.demo.Greeter;
import dev.wirecall.demo.GreeterError;
import dev.wirecall.greeter.service.GreetingService;
import dev.wirecall.rpc.RpcResult;

/**
 * Remote {@link Greeter} implementation. Delegates to {@link GreetingService} and turns its
 * failures into the error arm of each result, so they reach the caller as ordinary responses.
 */
@Component
@RequiredArgsConstructor
public class GreeterEndpoint implements Greeter {

	private static final Logger logger = LoggerFactory.getLogger(GreeterEndpoint.class);

	private final GreetingService greetingService;

	/**
	 * Describe a subject with a value.
	 * @param subject what is being described
	 * @param value value attributed to the subject
	 * @return the description, or an error for an invalid subject
	 */
	@Override
	public RpcResult<String, GreeterError> describe(String subject, int value) {
		try {
			return RpcResult.ok(this.greetingService.describe(subject, value));
		}
		catch (IllegalArgumentException ex) {
			logger.debug("Rejected describe call: {}", ex.getMessage());
			return RpcResult.err(GreeterError.of(ex.getMessage()));
		}
	}

	/**
	 * Report a failure chosen by the caller.
	 * @param reason message of the returned error
	 * @return an error carrying {@code reason}
	 */
	@Override
	public RpcResult<String, GreeterError> fail(String reason) {
		logger.debug("Failing on request: {}", reason);
		return RpcResult.err(GreeterError.of(reason));
	}

	/**
	 * Add two numbers.
	 * @param a first operand
	 * @param b second operand
	 * @return the sum, or an error on overflow
	 */
	@Override
	public RpcResult<Long, GreeterError> add(long a, long b) {
		try {
			return RpcResult.ok(this.greetingService.add(a, b));
		}
		catch (ArithmeticException ex) {
			return RpcResult.err(GreeterError.of("overflow adding " + a + " and " + b));
		}
	}

}
