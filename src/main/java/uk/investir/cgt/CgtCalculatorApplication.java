package uk.investir.cgt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CgtCalculatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CgtCalculatorApplication.class, args);
    }

}
