package com.vtb.nessus.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Веб-интерфейс генератора отчетов
 *
 * Запуск:
 * java -jar nessus-report-generator.jar --web
 *
 * Доступ:
 * http://localhost:8080/api/v1/health
 */
@SpringBootApplication
public class NessusReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(NessusReportApplication.class, args);
    }
}
