package de.leipzig.htwk.gitrdf.shacl2xsd;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Shacl2XsdApplication {
    public static void main(String[] args) {
        SpringApplication.run(Shacl2XsdApplication.class, args);
    }
}
