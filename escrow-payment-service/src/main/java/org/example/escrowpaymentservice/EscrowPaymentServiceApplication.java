package org.example.escrowpaymentservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SuppressWarnings("java:S1118")
@SpringBootApplication
public class EscrowPaymentServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EscrowPaymentServiceApplication.class, args);
    }

}
