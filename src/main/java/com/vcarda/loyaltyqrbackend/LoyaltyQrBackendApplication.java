package com.vcarda.loyaltyqrbackend;

import com.vcarda.loyaltyqrbackend.config.QrCodeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(QrCodeProperties.class)
public class LoyaltyQrBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoyaltyQrBackendApplication.class, args);
    }
}
