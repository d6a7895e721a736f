package com.sqljudge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SqlJudgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlJudgeApplication.class, args);
    }
}
