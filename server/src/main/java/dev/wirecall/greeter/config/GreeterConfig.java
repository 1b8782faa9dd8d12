package dev.wirecall.greeter.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration registering the greeter properties.
 */
@Configuration
@EnableConfigurationProperties(GreeterProperties.class)
public class GreeterConfig {

}
