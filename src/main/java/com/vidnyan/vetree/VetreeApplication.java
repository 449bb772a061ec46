package com.vidnyan.vetree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * VETREE - Verilog/SystemVerilog design indexer
 *
 * Builds a module/port/instance index and an instantiation hierarchy from HDL sources.
 */
@SpringBootApplication
public class VetreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(VetreeApplication.class, args);
    }
}
