package com.structura.labeling;

import com.structura.labeling.config.labeling.LabelingProperties;
import com.structura.labeling.config.remote.RemoteClassifierProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RemoteClassifierProperties.class,
        LabelingProperties.class
})
public class StructuraLabelingApplication {

    public static void main(String[] args) {
        SpringApplication.run(StructuraLabelingApplication.class, args);
    }

}
