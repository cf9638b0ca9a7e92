package com.invoicebot.mail;

import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.mail.runner.BackfillRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

@SpringBootApplication
@ComponentScan(basePackages = {"com.invoicebot.mail", "com.invoicebot.ai", "com.invoicebot.common"})
@EntityScan(basePackages = {"com.invoicebot.common.entity"})
@EnableJpaRepositories(basePackages = {"com.invoicebot.common.repository"})
@EnableConfigurationProperties(InvoiceBotProperties.class)
@EnableScheduling
public class InvoiceBotApplication {

    public static void main(String[] args) {
        boolean backfill = Arrays.stream(args).anyMatch(a -> a.equals("--" + BackfillRunner.BACKFILL_OPTION));
        if (backfill) {
            // one pass over history with the scheduler off, then exit
            String[] backfillArgs = Arrays.copyOf(args, args.length + 1);
            backfillArgs[args.length] = "--invoicebot.schedule.enabled=false";
            System.exit(SpringApplication.exit(SpringApplication.run(InvoiceBotApplication.class, backfillArgs)));
        }
        SpringApplication.run(InvoiceBotApplication.class, args);
    }

}
