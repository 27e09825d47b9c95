package com.phillippitts.transcripteval;

import com.phillippitts.transcripteval.config.properties.EvaluationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        EvaluationProperties.class
})
public class TranscriptEvalApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TranscriptEvalApplication.class, args)));
    }

}
