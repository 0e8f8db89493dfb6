package com.xksgroup.hlsmanifest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HlsManifestNormalizerApplication {
    public static void main(String[] args) {
        SpringApplication.run(HlsManifestNormalizerApplication.class, args);
    }
}
