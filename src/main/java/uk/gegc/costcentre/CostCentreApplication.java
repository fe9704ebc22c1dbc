package uk.gegc.costcentre;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CostCentreApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostCentreApplication.class, args);
    }
}
