package com.fhi.my_pets;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@SpringBootApplication
public class MyPetsApplication
{
    /**
     * Runs with the "local" profile unless told otherwise:
     * $ mvn spring-boot:run -Dspring-boot.run.profiles=prod
     */
    public static void main(String[] args)
    {
        SpringApplication.run(MyPetsApplication.class, args);
        log.info("MyPets API started");
    }
}
