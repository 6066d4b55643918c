package com.tencent.scanflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Scanflow Application Entry Point
 *
 * @author scanflow-team
 */
@SpringBootApplication
public class ScanflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanflowApplication.class, args);
    }
}
