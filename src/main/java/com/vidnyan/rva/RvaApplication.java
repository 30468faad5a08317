package com.vidnyan.rva;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RVA - Record Value Analyzer
 *
 * Reports record components (and fields of Lombok value classes) whose types
 * break the generated equals.
 */
@SpringBootApplication
public class RvaApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(RvaApplication.class, args)));
    }
}
