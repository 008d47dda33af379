package com.vidnyan.playscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Playscan - security smell scanner for playbooks and roles.
 *
 * Builds a program dependence graph per playbook or role and runs graph-based smell detectors over it.
 */
@SpringBootApplication
public class PlayscanApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlayscanApplication.class, args);
    }
}
