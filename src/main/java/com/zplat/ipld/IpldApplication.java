package com.zplat.ipld;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IpldApplication {

    public static void main(String[] args) {
        SpringApplication.run(IpldApplication.class, args);
    }
}
