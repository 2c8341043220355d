package com.vidnyan.flowchart;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Python to flowchart.js translator.
 *
 * Parses Python with ANTLR and prints the flowchart DSL of the program or of one field.
 */
@SpringBootApplication
public class FlowchartApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FlowchartApplication.class, args)));
    }
}
