package de.htwsaar.ministream.streamer;

import de.htwsaar.ministream.common.logging.LoggingConfig;
import de.htwsaar.ministream.common.web.CorsConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@Import({LoggingConfig.class, CorsConfig.class})
public class StreamerApp {
    public static void main(String[] args) {
        SpringApplication.run(StreamerApp.class, args);
    }
}
