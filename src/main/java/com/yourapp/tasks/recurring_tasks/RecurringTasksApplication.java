package com.yourapp.tasks.recurring_tasks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class RecurringTasksApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecurringTasksApplication.class, args);
    }

}
