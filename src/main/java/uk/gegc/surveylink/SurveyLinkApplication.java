package uk.gegc.surveylink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SurveyLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(SurveyLinkApplication.class, args);
    }
}
