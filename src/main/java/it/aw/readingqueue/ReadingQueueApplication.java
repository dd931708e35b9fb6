package it.aw.readingqueue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReadingQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReadingQueueApplication.class, args);
    }
}
