package io.nlpbridge;

import io.nlpbridge.corenlp.config.BridgeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BridgeConfig.class)
@ConfigurationPropertiesScan
public class NlpBridgeApplication {
    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");

        SpringApplication.run(NlpBridgeApplication.class, args);
    }
}
