package com.agileflow.planning.workgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkgraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkgraphApplication.class, args);
    }
}
