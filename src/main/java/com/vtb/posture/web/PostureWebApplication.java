package com.vtb.posture.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Веб-дашборд оценки защищенности
 *
 * Запуск:
 * java -jar api-posture-scorer.jar --web
 *
 * Доступ:
 * http://localhost:8080/api/v1/overview
 */
@SpringBootApplication
public class PostureWebApplication {

    public static void main(String[] args) {
        SpringApplication.run(PostureWebApplication.class, args);
    }
}
