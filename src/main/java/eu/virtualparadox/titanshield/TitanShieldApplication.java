package eu.virtualparadox.titanshield;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Vietnamese multiple-choice question answering: safety screening, rule-based routing and hybrid
 * (BM25 + vector) retrieval in front of a language model.
 */
@SpringBootApplication
public class TitanShieldApplication {

    public static void main(String[] args) {
        SpringApplication.run(TitanShieldApplication.class, args);
    }

}
