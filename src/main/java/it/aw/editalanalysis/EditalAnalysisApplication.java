package it.aw.editalanalysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EditalAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(EditalAnalysisApplication.class, args);
    }
}
