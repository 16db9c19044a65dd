package org.iceforge.strata.semantic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StrataSemanticLayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrataSemanticLayerApplication.class, args);
    }
}
