package com.example.kosagent;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan("com.example.kosagent.mapper")
public class KosAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(KosAgentApplication.class, args);
    }
}
