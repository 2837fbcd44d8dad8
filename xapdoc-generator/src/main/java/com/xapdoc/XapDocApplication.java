package com.xapdoc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XapDocApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(XapDocApplication.class, args)));
    }
}
