package dev.wirecall.server;

import dev.wirecall.demo.Greeter;
import dev.wirecall.server.config.ServerProperties;
import dev.wirecall.server.transport.TcpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication(scanBasePackages = "dev.wirecall")
@EnableConfigurationProperties(ServerProperties.class)
public class GreeterServerApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(GreeterServerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GreeterServerApplication.class, args);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    TcpServer tcpServer(ServerProperties properties, Greeter greeter) {
        LOGGER.info("Serving Greeter with the {} wire format", properties.getFormat());
        return new TcpServer(properties.getPort(), properties.getFormat(), properties.getMaxFrameLength(), greeter);
    }
}
