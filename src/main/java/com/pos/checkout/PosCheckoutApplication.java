package com.pos.checkout;

import com.pos.checkout.config.CheckoutProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@MapperScan("com.pos.checkout.mapper")
@EnableConfigurationProperties(CheckoutProperties.class)
public class PosCheckoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(PosCheckoutApplication.class, args);
    }
}
