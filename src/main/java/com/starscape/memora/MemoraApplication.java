package com.starscape.memora;

import com.starscape.memora.common.config.AccountProperties;
import com.starscape.memora.common.config.MetadataProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({MetadataProperties.class, AccountProperties.class})
public class MemoraApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoraApplication.class, args);
    }
}
