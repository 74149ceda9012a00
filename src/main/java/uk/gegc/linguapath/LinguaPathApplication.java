package uk.gegc.linguapath;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LinguaPathApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinguaPathApplication.class, args);
    }

}
