package uk.gegc.aianswers;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiAnswersApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiAnswersApplication.class, args);
    }
}
