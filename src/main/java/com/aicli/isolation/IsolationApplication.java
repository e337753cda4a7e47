package com.aicli.isolation;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class IsolationApplication {

    public static void main(String[] args) {
        // No HTTP surface and the monitor runs on daemon threads, so keep the context alive
        // until shutdown.
        new SpringApplicationBuilder(IsolationApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off",
                        "spring.main.keep-alive=true")
                .run(args);
    }
}
