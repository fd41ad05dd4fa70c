package org.example.encryptedqr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EncryptedQrApplication {

    public static void main(String[] args) {
        SpringApplication.run(EncryptedQrApplication.class, args);
    }

}
